package io.trektribe.backend.integration.email;

public record SendResult(boolean success, String providerMessageId, String errorMessage) {

  public static SendResult sent(String providerMessageId) {
    return new SendResult(true, providerMessageId, null);
  }

  public static SendResult failed(String errorMessage) {
    return new SendResult(false, null, errorMessage);
  }
}
