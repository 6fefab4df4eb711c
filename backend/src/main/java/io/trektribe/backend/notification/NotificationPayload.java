package io.trektribe.backend.notification;

import java.time.Instant;
import java.util.UUID;

/**
 * Public fields of a notification. Pushed over the real-time channel as-is and embedded in every
 * read response, so push and poll never disagree.
 */
public record NotificationPayload(
    UUID id,
    NotificationKind kind,
    String title,
    String body,
    NotificationContext context,
    Instant createdAt) {

  public static NotificationPayload from(Notification notification) {
    return new NotificationPayload(
        notification.getId(),
        notification.getKind(),
        notification.getTitle(),
        notification.getBody(),
        notification.getContext(),
        notification.getCreatedAt());
  }
}
