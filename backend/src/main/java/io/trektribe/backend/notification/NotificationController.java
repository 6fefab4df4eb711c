package io.trektribe.backend.notification;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

  private final NotificationService notificationService;

  public NotificationController(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @GetMapping
  public ResponseEntity<NotificationListResponse> listNotifications(
      @AuthenticationPrincipal Jwt jwt,
      @RequestParam(defaultValue = "1") int page,
      @RequestParam(defaultValue = "20") int limit,
      @RequestParam(defaultValue = "false") boolean unreadOnly) {
    var result = notificationService.list(jwt.getSubject(), page, limit, unreadOnly);
    return ResponseEntity.ok(NotificationListResponse.from(result));
  }

  @GetMapping("/unread-count")
  public ResponseEntity<UnreadCountResponse> getUnreadCount(@AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        new UnreadCountResponse(notificationService.unreadCount(jwt.getSubject())));
  }

  @GetMapping("/{id}")
  public ResponseEntity<NotificationResponse> getNotification(
      @AuthenticationPrincipal Jwt jwt, @PathVariable UUID id) {
    return ResponseEntity.ok(
        NotificationResponse.from(notificationService.find(jwt.getSubject(), id)));
  }

  @PutMapping("/mark-read")
  public ResponseEntity<UpdatedResponse> markAsRead(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody MarkReadRequest request) {
    int updated = notificationService.markRead(jwt.getSubject(), request.notificationIds());
    return ResponseEntity.ok(new UpdatedResponse(updated));
  }

  @PutMapping("/mark-all-read")
  public ResponseEntity<UpdatedResponse> markAllAsRead(@AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        new UpdatedResponse(notificationService.markAllRead(jwt.getSubject())));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteNotification(
      @AuthenticationPrincipal Jwt jwt, @PathVariable UUID id) {
    notificationService.delete(jwt.getSubject(), id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record NotificationResponse(
      UUID id,
      NotificationKind kind,
      String title,
      String body,
      NotificationContext context,
      Instant createdAt,
      boolean read,
      boolean emailMirrored) {

    public static NotificationResponse from(Notification notification) {
      var payload = NotificationPayload.from(notification);
      return new NotificationResponse(
          payload.id(),
          payload.kind(),
          payload.title(),
          payload.body(),
          payload.context(),
          payload.createdAt(),
          notification.isRead(),
          notification.isEmailMirrored());
    }
  }

  public record PaginationResponse(
      int page, int limit, long total, long pages, boolean hasNextPage, boolean hasPrevPage) {}

  public record NotificationListResponse(
      List<NotificationResponse> notifications, PaginationResponse pagination, long unreadCount) {

    public static NotificationListResponse from(NotificationPage page) {
      return new NotificationListResponse(
          page.items().stream().map(NotificationResponse::from).toList(),
          new PaginationResponse(
              page.page(),
              page.pageSize(),
              page.totalCount(),
              page.totalPages(),
              page.hasNextPage(),
              page.hasPrevPage()),
          page.unreadCount());
    }
  }

  public record MarkReadRequest(@NotEmpty List<UUID> notificationIds) {}

  public record UpdatedResponse(int updated) {}

  public record UnreadCountResponse(long count) {}
}
