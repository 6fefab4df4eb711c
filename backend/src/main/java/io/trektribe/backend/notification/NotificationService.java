package io.trektribe.backend.notification;

import io.trektribe.backend.account.AccountDirectory;
import io.trektribe.backend.config.NotificationProperties;
import io.trektribe.backend.config.NotificationProperties.DispatchMode;
import io.trektribe.backend.exception.ResourceNotFoundException;
import io.trektribe.backend.exception.ValidationFailedException;
import io.trektribe.backend.notification.email.EmailDispatcher;
import io.trektribe.backend.notification.realtime.RealtimePublisher;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Creates notifications and serves the recipient-scoped query surface.
 *
 * <p>{@link #create} has three steps that fail independently: the insert, which decides the outcome
 * of the call; the real-time push; and the optional email mirror. Push and mirror failures are
 * logged and never undo the stored record.
 */
@Service
public class NotificationService {

  private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

  static final int DEFAULT_PAGE_SIZE = 20;
  static final int MAX_PAGE_SIZE = 100;
  static final int MAX_TITLE_LENGTH = 500;
  static final int MAX_BODY_LENGTH = 4000;

  private final NotificationStore store;
  private final RealtimePublisher realtimePublisher;
  private final EmailDispatcher emailDispatcher;
  private final AccountDirectory accountDirectory;
  private final TaskExecutor emailMirrorExecutor;
  private final DispatchMode dispatchMode;

  public NotificationService(
      NotificationStore store,
      RealtimePublisher realtimePublisher,
      EmailDispatcher emailDispatcher,
      AccountDirectory accountDirectory,
      @Qualifier("emailMirrorExecutor") TaskExecutor emailMirrorExecutor,
      NotificationProperties properties) {
    this.store = store;
    this.realtimePublisher = realtimePublisher;
    this.emailDispatcher = emailDispatcher;
    this.accountDirectory = accountDirectory;
    this.emailMirrorExecutor = emailMirrorExecutor;
    this.dispatchMode = properties.email().dispatchMode();
  }

  public Notification create(String recipientId, NotificationDraft draft) {
    return create(
        recipientId,
        draft.kind(),
        draft.title(),
        draft.body(),
        draft.context(),
        draft.wantsEmail());
  }

  public Notification create(
      String recipientId,
      NotificationKind kind,
      String title,
      String body,
      NotificationContext context,
      boolean wantsEmail) {
    validate(recipientId, kind, title, body, context);

    var notification = store.insert(recipientId, kind, title.strip(), body.strip(), context);
    log.debug(
        "Created {} notification {} for {}", kind.wireValue(), notification.getId(), recipientId);

    try {
      realtimePublisher.publish(notification);
    } catch (RuntimeException e) {
      log.warn("Real-time push failed for notification {}", notification.getId(), e);
    }

    if (!wantsEmail || !emailDispatcher.isEnabled()) {
      return notification;
    }
    if (dispatchMode == DispatchMode.INLINE) {
      return mirrorToEmail(notification);
    }
    try {
      emailMirrorExecutor.execute(() -> mirrorToEmail(notification));
    } catch (TaskRejectedException e) {
      log.warn(
          "Email mirror queue full, dropping mirror for notification {}", notification.getId());
    }
    return notification;
  }

  /**
   * Sends the email mirror and sets the flag on success. Never throws.
   *
   * @return the record with its current mirror state
   */
  Notification mirrorToEmail(Notification notification) {
    try {
      var address = accountDirectory.resolveEmailAddress(notification.getRecipientId());
      if (address.isEmpty()) {
        log.warn(
            "No email address for recipient {}, notification {} not mirrored",
            notification.getRecipientId(),
            notification.getId());
        return notification;
      }
      var result = emailDispatcher.send(notification, address.get());
      if (!result.isDelivered()) {
        log.warn(
            "Email mirror {} for notification {}: {}",
            result.status(),
            notification.getId(),
            result.errorMessage());
        return notification;
      }
      return store.markEmailMirrored(notification.getId()).orElse(notification);
    } catch (RuntimeException e) {
      log.warn("Email mirror failed for notification {}", notification.getId(), e);
      return notification;
    }
  }

  public NotificationPage list(String recipientId, int page, int pageSize, boolean unreadOnly) {
    if (page < 1) {
      throw new ValidationFailedException("Invalid page", "page must be 1 or greater");
    }
    if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
      throw new ValidationFailedException(
          "Invalid page size", "limit must be between 1 and " + MAX_PAGE_SIZE);
    }
    var result = store.listByRecipient(recipientId, page, pageSize, unreadOnly);
    long unread = store.countUnread(recipientId);
    return new NotificationPage(
        result.getContent(), page, pageSize, result.getTotalElements(), unread);
  }

  public long unreadCount(String recipientId) {
    return store.countUnread(recipientId);
  }

  public Notification find(String recipientId, UUID id) {
    return store
        .findOwned(recipientId, id)
        .orElseThrow(() -> ResourceNotFoundException.notification(id));
  }

  public int markRead(String recipientId, Collection<UUID> ids) {
    if (ids == null || ids.isEmpty()) {
      throw new ValidationFailedException(
          "Invalid request", "notificationIds must contain at least one id");
    }
    if (ids.contains(null)) {
      throw new ValidationFailedException("Invalid request", "notificationIds must not be null");
    }
    return store.markRead(recipientId, new LinkedHashSet<>(ids));
  }

  public int markAllRead(String recipientId) {
    return store.markAllRead(recipientId);
  }

  public void delete(String recipientId, UUID id) {
    if (!store.deleteOwned(recipientId, id)) {
      throw ResourceNotFoundException.notification(id);
    }
  }

  /** Tells the organizer that someone joined their trip. */
  public Notification notifyTripJoin(
      String organizerId,
      String tripId,
      String tripTitle,
      String travelerId,
      String travelerName,
      int participantCount) {
    return create(
        organizerId,
        TripNotificationTemplates.tripJoined(
            tripId, tripTitle, travelerId, travelerName, participantCount));
  }

  /** Tells the organizer that someone left their trip. */
  public Notification notifyTripLeave(
      String organizerId,
      String tripId,
      String tripTitle,
      String travelerId,
      String travelerName,
      int participantCount) {
    return create(
        organizerId,
        TripNotificationTemplates.tripLeft(
            tripId, tripTitle, travelerId, travelerName, participantCount));
  }

  private static void validate(
      String recipientId,
      NotificationKind kind,
      String title,
      String body,
      NotificationContext context) {
    if (recipientId == null || recipientId.isBlank()) {
      throw new ValidationFailedException("Invalid notification", "recipientId is required");
    }
    if (kind == null) {
      throw new ValidationFailedException("Invalid notification", "kind is required");
    }
    if (title == null || title.isBlank()) {
      throw new ValidationFailedException("Invalid notification", "title must not be empty");
    }
    if (body == null || body.isBlank()) {
      throw new ValidationFailedException("Invalid notification", "body must not be empty");
    }
    if (title.strip().length() > MAX_TITLE_LENGTH || body.strip().length() > MAX_BODY_LENGTH) {
      throw new ValidationFailedException("Invalid notification", "title or body is too long");
    }
    if (context == null || !kind.accepts(context)) {
      throw new ValidationFailedException(
          "Invalid notification",
          "context does not match notification kind " + kind.wireValue());
    }
    if (NotificationContextConverter.serialize(context).length()
        > NotificationContextConverter.MAX_SERIALIZED_LENGTH) {
      throw new ValidationFailedException("Invalid notification", "context is too large");
    }
  }
}
