package io.trektribe.backend.notification.realtime;

import io.trektribe.backend.config.NotificationProperties;
import java.time.Clock;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Opens SSE streams for authenticated recipients and keeps the registry in step with them. */
@Service
public class NotificationStreamService {

  private static final Logger log = LoggerFactory.getLogger(NotificationStreamService.class);

  private final RecipientChannelRegistry registry;
  private final Executor realtimePushExecutor;
  private final Clock clock;
  private final NotificationProperties.Realtime settings;

  public NotificationStreamService(
      RecipientChannelRegistry registry,
      @Qualifier("realtimePushExecutor") Executor realtimePushExecutor,
      Clock clock,
      NotificationProperties properties) {
    this.registry = registry;
    this.realtimePushExecutor = realtimePushExecutor;
    this.clock = clock;
    this.settings = properties.realtime();
  }

  public SseEmitter open(String recipientId) {
    var emitter = new SseEmitter(settings.connectionTimeout().toMillis());
    var connection =
        new SseRealtimeConnection(
            recipientId,
            emitter,
            realtimePushExecutor,
            settings.bufferCapacity(),
            clock,
            registry::unregister);
    emitter.onCompletion(connection::detach);
    emitter.onTimeout(connection::detach);
    emitter.onError(e -> connection.detach());
    registry.register(recipientId, connection);
    log.info(
        "Opened notification stream {} for recipient {} ({} live)",
        connection.connectionId(),
        recipientId,
        registry.connectionCount());
    return emitter;
  }
}
