package io.trektribe.backend.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Worker pools for the notification pipeline. Each concern gets its own pool. */
@Configuration
@EnableConfigurationProperties(NotificationProperties.class)
public class TaskConfig {

  /**
   * Runs one create per recipient. A full queue rejects the task; the coordinator then runs it on
   * the calling thread, or reports it failed when the caller set a deadline.
   */
  @Bean
  public ThreadPoolTaskExecutor fanOutExecutor(NotificationProperties properties) {
    var fanOut = properties.fanOut();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(fanOut.parallelism());
    executor.setMaxPoolSize(fanOut.parallelism());
    executor.setQueueCapacity(fanOut.queueCapacity());
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setThreadNamePrefix("fan-out-");
    return executor;
  }

  /**
   * Background email mirrors. A full queue rejects the task, and the caller logs and drops the
   * mirror.
   */
  @Bean
  public ThreadPoolTaskExecutor emailMirrorExecutor(NotificationProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(properties.email().mirrorQueueCapacity());
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setThreadNamePrefix("email-mirror-");
    return executor;
  }

  /** Carries the blocking transport call so the dispatcher can bound it with a timeout. */
  @Bean
  public ThreadPoolTaskExecutor mailTransportExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(100);
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setThreadNamePrefix("mail-transport-");
    return executor;
  }

  /** Drains per-connection SSE buffers. */
  @Bean
  public ThreadPoolTaskExecutor realtimePushExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(10_000);
    executor.setThreadNamePrefix("sse-push-");
    return executor;
  }
}
