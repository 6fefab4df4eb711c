package io.trektribe.backend.integration.email;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fallback when no SMTP relay is configured. Logs what would have been sent. */
public class NoOpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpEmailProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    log.info("NoOp email: would send to {} with subject '{}'", message.to(), message.subject());
    return SendResult.sent(null);
  }
}
