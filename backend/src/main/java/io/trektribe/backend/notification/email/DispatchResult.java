package io.trektribe.backend.notification.email;

/** Outcome of one email mirror attempt. Failures are values, never exceptions. */
public record DispatchResult(Status status, String providerMessageId, String errorMessage) {

  public enum Status {
    DELIVERED,
    FAILED,
    /** No transport is configured; nothing was sent and nothing should be mirrored. */
    DISABLED
  }

  public static DispatchResult delivered(String providerMessageId) {
    return new DispatchResult(Status.DELIVERED, providerMessageId, null);
  }

  public static DispatchResult failed(String errorMessage) {
    return new DispatchResult(Status.FAILED, null, errorMessage);
  }

  public static DispatchResult disabled() {
    return new DispatchResult(Status.DISABLED, null, null);
  }

  public boolean isDelivered() {
    return status == Status.DELIVERED;
  }
}
