package io.trektribe.backend.notification;

import io.trektribe.backend.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Durable CRUD over notification records. Every operation except {@link #insert} is scoped by
 * recipient, and each one commits in its own transaction so a commit failure surfaces here as a
 * {@link NotificationStoreException}.
 */
@Component
public class NotificationStore {

  private static final Logger log = LoggerFactory.getLogger(NotificationStore.class);

  private static final Sort NEWEST_FIRST =
      Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

  private final NotificationRepository notificationRepository;
  private final NotificationSequencer sequencer;
  private final TransactionTemplate transactionTemplate;
  private final TransactionTemplate readOnlyTemplate;
  private final Clock clock;

  public NotificationStore(
      NotificationRepository notificationRepository,
      NotificationSequencer sequencer,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.notificationRepository = notificationRepository;
    this.sequencer = sequencer;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    // Writes are often issued from after-commit listeners, where joining would be a no-op.
    this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.readOnlyTemplate = new TransactionTemplate(transactionManager);
    this.readOnlyTemplate.setReadOnly(true);
    this.clock = clock;
  }

  public Notification insert(
      String recipientId,
      NotificationKind kind,
      String title,
      String body,
      NotificationContext context) {
    return inTransaction(
        "insert",
        transactionTemplate,
        () -> {
          var notification =
              new Notification(recipientId, kind, title, body, context, sequencer.next());
          return notificationRepository.saveAndFlush(notification);
        });
  }

  /** Newest first. {@code page} is 1-based. */
  public Page<Notification> listByRecipient(
      String recipientId, int page, int pageSize, boolean unreadOnly) {
    var pageable = PageRequest.of(page - 1, pageSize, NEWEST_FIRST);
    return inTransaction(
        "list",
        readOnlyTemplate,
        () ->
            unreadOnly
                ? notificationRepository.findUnreadByRecipient(recipientId, pageable)
                : notificationRepository.findByRecipient(recipientId, pageable));
  }

  public long countUnread(String recipientId) {
    return inTransaction(
        "countUnread",
        readOnlyTemplate,
        () -> notificationRepository.countUnreadByRecipient(recipientId));
  }

  public Optional<Notification> findOwned(String recipientId, UUID id) {
    return inTransaction(
        "find",
        readOnlyTemplate,
        () -> notificationRepository.findByIdAndRecipientId(id, recipientId));
  }

  /**
   * Flips the owned, unread ids in {@code ids} to read and returns how many changed. If any id is
   * not owned by {@code recipientId} nothing changes and the call fails as not found.
   */
  public int markRead(String recipientId, Set<UUID> ids) {
    return inTransaction(
        "markRead",
        transactionTemplate,
        () -> {
          long owned = notificationRepository.countOwned(recipientId, ids);
          if (owned != ids.size()) {
            throw ResourceNotFoundException.notifications();
          }
          return notificationRepository.markRead(recipientId, ids, now());
        });
  }

  public int markAllRead(String recipientId) {
    return inTransaction(
        "markAllRead",
        transactionTemplate,
        () -> notificationRepository.markAllRead(recipientId, now()));
  }

  /** Sets the mirror flag and returns the reloaded record, or empty if it has been deleted. */
  public Optional<Notification> markEmailMirrored(UUID id) {
    return inTransaction(
        "markEmailMirrored",
        transactionTemplate,
        () -> {
          notificationRepository.markEmailMirrored(id, now());
          return notificationRepository.findById(id);
        });
  }

  public boolean deleteOwned(String recipientId, UUID id) {
    return inTransaction(
        "delete",
        transactionTemplate,
        () -> notificationRepository.deleteOwned(id, recipientId) > 0);
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }

  private <T> T inTransaction(String operation, TransactionTemplate template, Supplier<T> work) {
    try {
      return template.execute(status -> work.get());
    } catch (DataAccessException | TransactionException e) {
      log.debug("Notification store operation '{}' failed", operation, e);
      throw new NotificationStoreException(operation, e);
    }
  }
}
