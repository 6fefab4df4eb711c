package io.trektribe.backend.notification.realtime;

import static org.assertj.core.api.Assertions.assertThat;

import io.trektribe.backend.notification.NotificationKind;
import io.trektribe.backend.notification.NotificationPayload;
import io.trektribe.backend.notification.SystemContext;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter.DataWithMediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

class SseRealtimeConnectionTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-05-01T08:00:00Z"), ZoneOffset.UTC);

  private CapturingEmitter emitter;
  private AtomicInteger closeCallbacks;

  @BeforeEach
  void setUp() {
    emitter = new CapturingEmitter();
    closeCallbacks = new AtomicInteger();
  }

  @Test
  void offeredPayloadIsWrittenAsNotificationEvent() {
    var connection = connection(Runnable::run, 4);
    var payload = payload();

    assertThat(connection.offer(payload)).isTrue();

    assertThat(emitter.sent).hasSize(1);
    var parts = emitter.sent.get(0);
    assertThat(parts).extracting(DataWithMediaType::getData).contains(payload);
    assertThat(text(parts)).contains("event:notification").contains("id:" + payload.id());
  }

  @Test
  void heartbeatIsWrittenAsHeartbeatEvent() {
    var connection = connection(Runnable::run, 4);

    assertThat(connection.heartbeat()).isTrue();

    assertThat(text(emitter.sent.get(0))).contains("event:heartbeat");
  }

  @Test
  void fullBufferDropsEventWithoutBlocking() {
    List<Runnable> parked = new ArrayList<>();
    var connection = connection(parked::add, 2);

    assertThat(connection.offer(payload())).isTrue();
    assertThat(connection.offer(payload())).isTrue();
    assertThat(connection.offer(payload())).isFalse();

    assertThat(parked).hasSize(1);
    parked.get(0).run();
    assertThat(emitter.sent).hasSize(2);
    assertThat(connection.buffered()).isZero();
  }

  @Test
  void writeFailureClosesAndUnregistersOnce() {
    emitter.failWrites = true;
    var connection = connection(Runnable::run, 4);

    connection.offer(payload());

    assertThat(connection.isClosed()).isTrue();
    assertThat(closeCallbacks).hasValue(1);
    assertThat(connection.offer(payload())).isFalse();
    connection.detach();
    assertThat(closeCallbacks).hasValue(1);
  }

  @Test
  void conversionFailureClosesConnection() {
    emitter.failure = new HttpMessageNotWritableException("No converter for payload");
    var connection = connection(Runnable::run, 4);

    connection.offer(payload());

    assertThat(connection.isClosed()).isTrue();
    assertThat(closeCallbacks).hasValue(1);
    assertThat(connection.buffered()).isZero();
    assertThat(connection.offer(payload())).isFalse();
  }

  @Test
  void closeIsIdempotent() {
    var connection = connection(Runnable::run, 4);

    connection.close();
    connection.close();
    connection.detach();

    assertThat(closeCallbacks).hasValue(1);
    assertThat(connection.heartbeat()).isFalse();
  }

  private SseRealtimeConnection connection(Executor executor, int capacity) {
    return new SseRealtimeConnection(
        "alice", emitter, executor, capacity, CLOCK, c -> closeCallbacks.incrementAndGet());
  }

  private static NotificationPayload payload() {
    return new NotificationPayload(
        UUID.randomUUID(),
        NotificationKind.SYSTEM,
        "Test Notification",
        "Body",
        SystemContext.empty(),
        Instant.parse("2026-05-01T07:59:59.123456Z"));
  }

  private static String text(Set<DataWithMediaType> parts) {
    var builder = new StringBuilder();
    for (DataWithMediaType part : parts) {
      if (part.getData() instanceof String s) {
        builder.append(s);
      }
    }
    return builder.toString();
  }

  static class CapturingEmitter extends SseEmitter {

    final List<Set<DataWithMediaType>> sent = new CopyOnWriteArrayList<>();
    volatile boolean failWrites;
    volatile RuntimeException failure;

    @Override
    public void send(SseEventBuilder builder) throws IOException {
      if (failWrites) {
        throw new IOException("Broken pipe");
      }
      if (failure != null) {
        throw failure;
      }
      sent.add(builder.build());
    }
  }
}
