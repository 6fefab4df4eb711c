package io.trektribe.backend.dev;

import io.trektribe.backend.notification.NotificationController.NotificationResponse;
import io.trektribe.backend.notification.NotificationKind;
import io.trektribe.backend.notification.NotificationService;
import io.trektribe.backend.notification.SystemContext;
import java.util.Map;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/** Lets a developer check the whole pipeline end to end. Not registered in production. */
@RestController
@Profile({"local", "dev", "test"})
public class DevNotificationController {

  private final NotificationService notificationService;

  public DevNotificationController(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @PostMapping("/api/notifications/test")
  public ResponseEntity<NotificationResponse> createTestNotification(
      @AuthenticationPrincipal Jwt jwt) {
    var notification =
        notificationService.create(
            jwt.getSubject(),
            NotificationKind.SYSTEM,
            "Test Notification",
            "This is a test notification to verify the system is working correctly.",
            new SystemContext(Map.of("testData", "Hello World!")),
            false);
    return ResponseEntity.status(HttpStatus.CREATED).body(NotificationResponse.from(notification));
  }
}
