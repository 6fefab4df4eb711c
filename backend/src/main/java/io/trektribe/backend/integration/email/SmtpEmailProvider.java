package io.trektribe.backend.integration.email;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

/**
 * Sends through {@link JavaMailSender}. Registered by {@link EmailProviderConfig} only when {@code
 * spring.mail.host} is configured.
 */
public class SmtpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(SmtpEmailProvider.class);

  private final JavaMailSender mailSender;
  private final String senderAddress;

  public SmtpEmailProvider(JavaMailSender mailSender, String senderAddress) {
    this.mailSender = mailSender;
    this.senderAddress = senderAddress;
  }

  @Override
  public String providerId() {
    return "smtp";
  }

  @Override
  public boolean isEnabled() {
    return true;
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    try {
      MimeMessage mimeMessage = mailSender.createMimeMessage();
      var helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
      helper.setFrom(senderAddress);
      helper.setTo(message.to());
      helper.setSubject(message.subject());
      if (message.htmlBody() != null && message.plainTextBody() != null) {
        helper.setText(message.plainTextBody(), message.htmlBody());
      } else if (message.htmlBody() != null) {
        helper.setText(message.htmlBody(), true);
      } else {
        helper.setText(message.plainTextBody(), false);
      }
      mailSender.send(mimeMessage);
      String messageId = mimeMessage.getMessageID();
      log.debug("SMTP email sent to {} with Message-ID: {}", message.to(), messageId);
      return SendResult.sent(messageId);
    } catch (MailException | MessagingException e) {
      log.warn("Failed to send SMTP email to {}: {}", message.to(), e.getMessage());
      return SendResult.failed(e.getMessage());
    }
  }
}
