package io.trektribe.backend.notification.realtime;

import io.trektribe.backend.notification.Notification;
import io.trektribe.backend.notification.NotificationPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Best-effort push of a stored notification to its recipient's live connections. Nothing is queued
 * for redelivery; the store stays the source of truth.
 */
@Component
public class RealtimePublisher {

  private static final Logger log = LoggerFactory.getLogger(RealtimePublisher.class);

  private final RecipientChannelRegistry registry;

  public RealtimePublisher(RecipientChannelRegistry registry) {
    this.registry = registry;
  }

  /**
   * @return number of connections that accepted the payload; zero when the recipient is offline
   */
  public int publish(Notification notification) {
    var connections = registry.activeConnections(notification.getRecipientId());
    if (connections.isEmpty()) {
      return 0;
    }
    var payload = NotificationPayload.from(notification);
    int accepted = 0;
    for (RealtimeConnection connection : connections) {
      if (connection.offer(payload)) {
        accepted++;
      } else {
        log.debug(
            "Connection {} dropped notification {}", connection.connectionId(), payload.id());
      }
    }
    return accepted;
  }
}
