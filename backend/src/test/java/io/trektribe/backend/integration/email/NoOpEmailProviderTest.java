package io.trektribe.backend.integration.email;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class NoOpEmailProviderTest {

  private final NoOpEmailProvider provider = new NoOpEmailProvider();

  @Test
  void isDisabled() {
    assertThat(provider.isEnabled()).isFalse();
    assertThat(provider.providerId()).isEqualTo("noop");
  }

  @Test
  void acceptsMessagesWithoutSending() {
    var result =
        provider.sendEmail(new EmailMessage("someone@example.com", "Subject", "<p>Hi</p>", "Hi"));

    assertThat(result.success()).isTrue();
    assertThat(result.errorMessage()).isNull();
  }
}
