package io.trektribe.backend.notification.realtime;

import io.trektribe.backend.notification.NotificationPayload;

/** One live push connection. Implementations must never block the caller. */
public interface RealtimeConnection {

  String connectionId();

  /**
   * Queues a payload for delivery.
   *
   * @return false if the connection is closed or its buffer is full; the payload is then dropped
   */
  boolean offer(NotificationPayload payload);

  /** Queues a keep-alive; same contract as {@link #offer}. */
  boolean heartbeat();

  void close();
}
