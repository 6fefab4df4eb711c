package io.trektribe.backend.integration.email;

/** Outbound mail transport. Implementations report failures in the result, they do not throw. */
public interface EmailProvider {

  /** Provider identifier, e.g. "smtp" or "noop". */
  String providerId();

  /** False when no real transport is configured; sends are then accepted but go nowhere. */
  boolean isEnabled();

  SendResult sendEmail(EmailMessage message);
}
