package io.trektribe.backend.notification;

import io.trektribe.backend.event.TripDeletedEvent;
import io.trektribe.backend.event.TripEvent;
import io.trektribe.backend.event.TripJoinedEvent;
import io.trektribe.backend.event.TripLeftEvent;
import io.trektribe.backend.event.TripUpdatedEvent;
import io.trektribe.backend.notification.fanout.FanOutCoordinator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Turns committed trip events into notifications. Handlers run AFTER_COMMIT, so:
 *
 * <ol>
 *   <li>notifications only exist for trip changes that actually committed, and
 *   <li>a notification failure can never undo the trip change.
 * </ol>
 *
 * <p>Events published outside a transaction are handled immediately.
 */
@Component
public class NotificationEventHandler {

  private static final Logger log = LoggerFactory.getLogger(NotificationEventHandler.class);

  private final NotificationService notificationService;
  private final FanOutCoordinator fanOutCoordinator;

  public NotificationEventHandler(
      NotificationService notificationService, FanOutCoordinator fanOutCoordinator) {
    this.notificationService = notificationService;
    this.fanOutCoordinator = fanOutCoordinator;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onTripJoined(TripJoinedEvent event) {
    logReceived(event);
    if (event.organizerId() == null || event.organizerId().equals(event.actorId())) {
      return;
    }
    try {
      notificationService.notifyTripJoin(
          event.organizerId(),
          event.tripId(),
          event.tripTitle(),
          event.actorId(),
          event.actorName(),
          event.participantCount());
    } catch (Exception e) {
      log.warn("Failed to create notification for trip.joined trip={}", event.tripId(), e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onTripLeft(TripLeftEvent event) {
    logReceived(event);
    if (event.organizerId() == null || event.organizerId().equals(event.actorId())) {
      return;
    }
    try {
      notificationService.notifyTripLeave(
          event.organizerId(),
          event.tripId(),
          event.tripTitle(),
          event.actorId(),
          event.actorName(),
          event.participantCount());
    } catch (Exception e) {
      log.warn("Failed to create notification for trip.left trip={}", event.tripId(), e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onTripUpdated(TripUpdatedEvent event) {
    logReceived(event);
    var recipients = excludingActor(event.participantIds(), event.actorId());
    if (recipients.isEmpty()) {
      return;
    }
    try {
      fanOutCoordinator.fanOut(
          recipients,
          TripNotificationTemplates.tripUpdated(
              event.tripId(),
              event.tripTitle(),
              event.actorId(),
              event.actorName(),
              event.changedFields()));
    } catch (Exception e) {
      log.warn("Failed to fan out trip.updated trip={}", event.tripId(), e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onTripDeleted(TripDeletedEvent event) {
    logReceived(event);
    var recipients = excludingActor(event.participantIds(), event.actorId());
    if (recipients.isEmpty()) {
      return;
    }
    try {
      fanOutCoordinator.fanOut(
          recipients,
          TripNotificationTemplates.tripDeleted(
              event.tripId(), event.tripTitle(), event.actorId(), event.actorName()));
    } catch (Exception e) {
      log.warn("Failed to fan out trip.deleted trip={}", event.tripId(), e);
    }
  }

  private static void logReceived(TripEvent event) {
    log.debug(
        "Handling {} for trip {} (occurred at {})",
        event.getClass().getSimpleName(),
        event.tripId(),
        event.occurredAt());
  }

  private static List<String> excludingActor(List<String> participantIds, String actorId) {
    if (participantIds == null) {
      return List.of();
    }
    return participantIds.stream().filter(id -> id != null && !id.equals(actorId)).toList();
  }
}
