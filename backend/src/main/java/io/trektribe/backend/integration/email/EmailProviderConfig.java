package io.trektribe.backend.integration.email;

import io.trektribe.backend.config.NotificationProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

/** Picks the SMTP transport when a relay is configured, otherwise the no-op one. */
@Configuration
public class EmailProviderConfig {

  @Bean
  @ConditionalOnProperty(name = "spring.mail.host")
  public EmailProvider smtpEmailProvider(
      JavaMailSender mailSender, NotificationProperties properties) {
    return new SmtpEmailProvider(mailSender, properties.email().senderAddress());
  }

  @Bean
  @ConditionalOnMissingBean(EmailProvider.class)
  public EmailProvider noOpEmailProvider() {
    return new NoOpEmailProvider();
  }
}
