package io.trektribe.backend.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "notifications")
public class Notification {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "recipient_id", nullable = false, updatable = false, length = 64)
  private String recipientId;

  @Convert(converter = NotificationKindConverter.class)
  @Column(name = "kind", nullable = false, updatable = false, length = 32)
  private NotificationKind kind;

  @Column(name = "title", nullable = false, updatable = false, length = 500)
  private String title;

  @Column(name = "body", nullable = false, updatable = false, length = 4000)
  private String body;

  @Convert(converter = NotificationContextConverter.class)
  @Column(
      name = "context",
      updatable = false,
      length = NotificationContextConverter.MAX_SERIALIZED_LENGTH)
  private NotificationContext context;

  @Column(name = "is_read", nullable = false)
  private boolean isRead;

  @Column(name = "email_mirrored", nullable = false)
  private boolean emailMirrored;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Notification() {}

  public Notification(
      String recipientId,
      NotificationKind kind,
      String title,
      String body,
      NotificationContext context,
      Instant createdAt) {
    this.recipientId = recipientId;
    this.kind = kind;
    this.title = title;
    this.body = body;
    this.context = context;
    this.isRead = false;
    this.emailMirrored = false;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public String getRecipientId() {
    return recipientId;
  }

  public NotificationKind getKind() {
    return kind;
  }

  public String getTitle() {
    return title;
  }

  public String getBody() {
    return body;
  }

  public NotificationContext getContext() {
    return context;
  }

  public boolean isRead() {
    return isRead;
  }

  public boolean isEmailMirrored() {
    return emailMirrored;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
