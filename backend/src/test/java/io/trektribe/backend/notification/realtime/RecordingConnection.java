package io.trektribe.backend.notification.realtime;

import io.trektribe.backend.notification.NotificationPayload;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/** In-memory connection that keeps every payload it accepts. */
public class RecordingConnection implements RealtimeConnection {

  private final String connectionId = UUID.randomUUID().toString();
  private final List<NotificationPayload> received = new CopyOnWriteArrayList<>();
  private volatile boolean accepting = true;
  private volatile int heartbeats;
  private volatile boolean closed;

  @Override
  public String connectionId() {
    return connectionId;
  }

  @Override
  public boolean offer(NotificationPayload payload) {
    if (!accepting || closed) {
      return false;
    }
    received.add(payload);
    return true;
  }

  @Override
  public boolean heartbeat() {
    heartbeats++;
    return !closed;
  }

  @Override
  public void close() {
    closed = true;
  }

  public RecordingConnection rejecting() {
    this.accepting = false;
    return this;
  }

  public List<NotificationPayload> received() {
    return received;
  }

  public int heartbeats() {
    return heartbeats;
  }
}
