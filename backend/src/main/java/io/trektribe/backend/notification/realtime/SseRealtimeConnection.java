package io.trektribe.backend.notification.realtime;

import io.trektribe.backend.notification.NotificationPayload;
import java.io.IOException;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * A server-sent events connection with its own bounded buffer. {@link #offer} only enqueues; a
 * single drain task at a time writes the buffer to the emitter on the shared push executor.
 */
public class SseRealtimeConnection implements RealtimeConnection {

  private static final Logger log = LoggerFactory.getLogger(SseRealtimeConnection.class);

  static final String NOTIFICATION_EVENT = "notification";
  static final String HEARTBEAT_EVENT = "heartbeat";

  private final String connectionId = UUID.randomUUID().toString();
  private final String recipientId;
  private final SseEmitter emitter;
  private final Executor pushExecutor;
  private final Clock clock;
  private final Consumer<RealtimeConnection> onClose;
  private final BlockingQueue<SseEmitter.SseEventBuilder> buffer;
  private final AtomicBoolean draining = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();

  public SseRealtimeConnection(
      String recipientId,
      SseEmitter emitter,
      Executor pushExecutor,
      int bufferCapacity,
      Clock clock,
      Consumer<RealtimeConnection> onClose) {
    this.recipientId = recipientId;
    this.emitter = emitter;
    this.pushExecutor = pushExecutor;
    this.clock = clock;
    this.onClose = onClose;
    this.buffer = new ArrayBlockingQueue<>(bufferCapacity);
  }

  @Override
  public String connectionId() {
    return connectionId;
  }

  @Override
  public boolean offer(NotificationPayload payload) {
    return enqueue(
        SseEmitter.event()
            .id(payload.id().toString())
            .name(NOTIFICATION_EVENT)
            .data(payload, MediaType.APPLICATION_JSON));
  }

  @Override
  public boolean heartbeat() {
    return enqueue(SseEmitter.event().name(HEARTBEAT_EVENT).data(clock.instant().toString()));
  }

  /** Server-side close: completes the response and unregisters. */
  @Override
  public void close() {
    if (markClosed()) {
      emitter.complete();
    }
  }

  /** The emitter finished on its own (client gone, timeout, error); only unregister. */
  void detach() {
    markClosed();
  }

  boolean isClosed() {
    return closed.get();
  }

  int buffered() {
    return buffer.size();
  }

  private boolean enqueue(SseEmitter.SseEventBuilder event) {
    if (closed.get()) {
      return false;
    }
    if (!buffer.offer(event)) {
      log.warn(
          "SSE buffer full for connection {} of {}, dropping event", connectionId, recipientId);
      return false;
    }
    scheduleDrain();
    return true;
  }

  private void scheduleDrain() {
    if (closed.get() || !draining.compareAndSet(false, true)) {
      return;
    }
    try {
      pushExecutor.execute(this::drain);
    } catch (RejectedExecutionException e) {
      draining.set(false);
      log.warn(
          "Push executor saturated; connection {} keeps {} buffered", connectionId, buffered());
    }
  }

  private void drain() {
    try {
      SseEmitter.SseEventBuilder event;
      while (!closed.get() && (event = buffer.poll()) != null) {
        emitter.send(event);
      }
    } catch (IOException | RuntimeException e) {
      log.debug("SSE write failed for connection {} of {}, closing", connectionId, recipientId, e);
      if (markClosed()) {
        emitter.completeWithError(e);
      }
      return;
    } finally {
      draining.set(false);
    }
    if (!buffer.isEmpty()) {
      scheduleDrain();
    }
  }

  private boolean markClosed() {
    if (!closed.compareAndSet(false, true)) {
      return false;
    }
    buffer.clear();
    onClose.accept(this);
    return true;
  }
}
