package io.trektribe.backend.notification.realtime;

import io.trektribe.backend.config.NotificationProperties;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

/**
 * Keeps idle streams open through proxies that cut silent connections. Runs every {@code
 * trektribe.notifications.realtime.heartbeat-interval}.
 */
@Component
public class RealtimeHeartbeat implements SchedulingConfigurer {

  private static final Logger log = LoggerFactory.getLogger(RealtimeHeartbeat.class);

  private final RecipientChannelRegistry registry;
  private final Duration interval;

  public RealtimeHeartbeat(RecipientChannelRegistry registry, NotificationProperties properties) {
    this.registry = registry;
    this.interval = properties.realtime().heartbeatInterval();
  }

  @Override
  public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
    taskRegistrar.addFixedDelayTask(this::beat, interval);
  }

  public void beat() {
    var connections = registry.allConnections();
    if (connections.isEmpty()) {
      return;
    }
    int skipped = 0;
    for (RealtimeConnection connection : connections) {
      if (!connection.heartbeat()) {
        skipped++;
      }
    }
    log.debug("Heartbeat sent to {} connections, {} skipped", connections.size(), skipped);
  }
}
