package io.trektribe.backend.notification;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Hands out creation timestamps that strictly increase within this process, at microsecond
 * resolution so they survive a round trip through the database unchanged.
 */
@Component
public class NotificationSequencer {

  private final Clock clock;
  private final AtomicLong lastMicros = new AtomicLong();

  public NotificationSequencer(Clock clock) {
    this.clock = clock;
  }

  public Instant next() {
    long now = ChronoUnit.MICROS.between(Instant.EPOCH, clock.instant());
    long micros = lastMicros.updateAndGet(prev -> Math.max(prev + 1, now));
    return Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
  }
}
