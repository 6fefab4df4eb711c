package io.trektribe.backend.notification;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

  @Query(
      value =
          """
          SELECT n FROM Notification n
          WHERE n.recipientId = :recipientId
          """,
      countQuery =
          """
          SELECT COUNT(n) FROM Notification n
          WHERE n.recipientId = :recipientId
          """)
  Page<Notification> findByRecipient(
      @Param("recipientId") String recipientId, Pageable pageable);

  @Query(
      value =
          """
          SELECT n FROM Notification n
          WHERE n.recipientId = :recipientId
            AND n.isRead = false
          """,
      countQuery =
          """
          SELECT COUNT(n) FROM Notification n
          WHERE n.recipientId = :recipientId
            AND n.isRead = false
          """)
  Page<Notification> findUnreadByRecipient(
      @Param("recipientId") String recipientId, Pageable pageable);

  Optional<Notification> findByIdAndRecipientId(UUID id, String recipientId);

  @Query(
      """
      SELECT COUNT(n) FROM Notification n
      WHERE n.recipientId = :recipientId
        AND n.isRead = false
      """)
  long countUnreadByRecipient(@Param("recipientId") String recipientId);

  @Query(
      """
      SELECT COUNT(n) FROM Notification n
      WHERE n.recipientId = :recipientId
        AND n.id IN :ids
      """)
  long countOwned(@Param("recipientId") String recipientId, @Param("ids") Collection<UUID> ids);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Notification n SET n.isRead = true, n.updatedAt = :now
      WHERE n.recipientId = :recipientId
        AND n.id IN :ids
        AND n.isRead = false
      """)
  int markRead(
      @Param("recipientId") String recipientId,
      @Param("ids") Collection<UUID> ids,
      @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Notification n SET n.isRead = true, n.updatedAt = :now
      WHERE n.recipientId = :recipientId
        AND n.isRead = false
      """)
  int markAllRead(@Param("recipientId") String recipientId, @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Notification n SET n.emailMirrored = true, n.updatedAt = :now
      WHERE n.id = :id
        AND n.emailMirrored = false
      """)
  int markEmailMirrored(@Param("id") UUID id, @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      DELETE FROM Notification n
      WHERE n.id = :id
        AND n.recipientId = :recipientId
      """)
  int deleteOwned(@Param("id") UUID id, @Param("recipientId") String recipientId);
}
