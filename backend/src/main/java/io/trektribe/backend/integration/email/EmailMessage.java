package io.trektribe.backend.integration.email;

import java.util.Objects;

/** Transport-agnostic email: recipient, subject, and HTML body with a plain-text fallback. */
public record EmailMessage(String to, String subject, String htmlBody, String plainTextBody) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    if (htmlBody == null && plainTextBody == null) {
      throw new IllegalArgumentException(
          "Email must have at least one of htmlBody or plainTextBody");
    }
  }

  public static EmailMessage of(String to, RenderedEmail rendered) {
    return new EmailMessage(
        to, rendered.subject(), rendered.htmlBody(), rendered.plainTextBody());
  }
}
