package io.trektribe.backend.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tuning for the notification pipeline.
 *
 * @param appBaseUrl base URL of the web client, used for deep links in emails
 * @param email email mirror settings
 * @param realtime server-sent events settings
 * @param fanOut multi-recipient fan-out settings
 */
@ConfigurationProperties(prefix = "trektribe.notifications")
public record NotificationProperties(
    @DefaultValue("http://localhost:3000") String appBaseUrl,
    @DefaultValue Email email,
    @DefaultValue Realtime realtime,
    @DefaultValue FanOut fanOut) {

  public enum DispatchMode {
    /** Send while {@code create} waits, swallowing failures. */
    INLINE,
    /** Hand the send to a bounded worker queue and return immediately. */
    BACKGROUND
  }

  public record Email(
      @DefaultValue("noreply@trektribe.local") String senderAddress,
      @DefaultValue("10s") Duration sendTimeout,
      @DefaultValue("BACKGROUND") DispatchMode dispatchMode,
      @DefaultValue("500") int mirrorQueueCapacity) {}

  public record Realtime(
      @DefaultValue("30m") Duration connectionTimeout,
      @DefaultValue("64") int bufferCapacity,
      @DefaultValue("25s") Duration heartbeatInterval) {}

  public record FanOut(
      @DefaultValue("8") int parallelism, @DefaultValue("1000") int queueCapacity) {}
}
