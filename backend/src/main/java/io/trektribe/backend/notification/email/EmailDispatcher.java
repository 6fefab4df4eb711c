package io.trektribe.backend.notification.email;

import io.trektribe.backend.config.NotificationProperties;
import io.trektribe.backend.integration.email.EmailMessage;
import io.trektribe.backend.integration.email.EmailProvider;
import io.trektribe.backend.integration.email.SendResult;
import io.trektribe.backend.notification.Notification;
import io.trektribe.backend.notification.template.EmailContextBuilder;
import io.trektribe.backend.notification.template.EmailTemplateRenderer;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Renders a notification into an email and hands it to the configured {@link EmailProvider}. The
 * transport call runs on its own executor so it can be bounded by the configured send timeout. No
 * retries.
 */
@Component
public class EmailDispatcher {

  private static final Logger log = LoggerFactory.getLogger(EmailDispatcher.class);

  private static final Pattern ADDRESS = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
  private static final String TEMPLATE = "notification";

  private final EmailProvider emailProvider;
  private final EmailTemplateRenderer renderer;
  private final EmailContextBuilder contextBuilder;
  private final AsyncTaskExecutor mailTransportExecutor;
  private final Duration sendTimeout;

  public EmailDispatcher(
      EmailProvider emailProvider,
      EmailTemplateRenderer renderer,
      EmailContextBuilder contextBuilder,
      @Qualifier("mailTransportExecutor") AsyncTaskExecutor mailTransportExecutor,
      NotificationProperties properties) {
    this.emailProvider = emailProvider;
    this.renderer = renderer;
    this.contextBuilder = contextBuilder;
    this.mailTransportExecutor = mailTransportExecutor;
    this.sendTimeout = properties.email().sendTimeout();
  }

  public boolean isEnabled() {
    return emailProvider.isEnabled();
  }

  public DispatchResult send(Notification notification, String recipientAddress) {
    if (!isEnabled()) {
      return DispatchResult.disabled();
    }
    if (recipientAddress == null || !ADDRESS.matcher(recipientAddress.trim()).matches()) {
      return DispatchResult.failed("Malformed recipient address");
    }

    var rendered = renderer.render(TEMPLATE, contextBuilder.buildNotificationContext(notification));
    var message = EmailMessage.of(recipientAddress.trim(), rendered);

    Future<SendResult> pending;
    try {
      pending = mailTransportExecutor.submit(() -> emailProvider.sendEmail(message));
    } catch (TaskRejectedException e) {
      return DispatchResult.failed("Mail transport saturated");
    }

    try {
      SendResult result = pending.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
      if (result.success()) {
        log.debug(
            "Mirrored notification {} via {} ({})",
            notification.getId(),
            emailProvider.providerId(),
            result.providerMessageId());
        return DispatchResult.delivered(result.providerMessageId());
      }
      return DispatchResult.failed(result.errorMessage());
    } catch (TimeoutException e) {
      pending.cancel(true);
      return DispatchResult.failed("Mail transport timed out after " + sendTimeout);
    } catch (ExecutionException e) {
      return DispatchResult.failed(String.valueOf(e.getCause()));
    } catch (InterruptedException e) {
      pending.cancel(true);
      Thread.currentThread().interrupt();
      return DispatchResult.failed("Interrupted while sending");
    }
  }
}
