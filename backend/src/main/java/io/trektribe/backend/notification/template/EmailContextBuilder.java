package io.trektribe.backend.notification.template;

import io.trektribe.backend.config.NotificationProperties;
import io.trektribe.backend.notification.Notification;
import java.util.HashMap;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/** Template variables for a notification email. Depends only on the notification itself. */
@Component
public class EmailContextBuilder {

  static final String BRAND_COLOR = "#2E7D32";

  private final String appBaseUrl;

  public EmailContextBuilder(NotificationProperties properties) {
    this.appBaseUrl = properties.appBaseUrl();
  }

  public Map<String, Object> buildNotificationContext(Notification notification) {
    var context = new HashMap<String, Object>();
    context.put("subject", notification.getTitle());
    context.put("title", notification.getTitle());
    context.put("body", notification.getBody());
    context.put("brandColor", BRAND_COLOR);
    context.put("appUrl", appBaseUrl);
    context.put(
        "tripUrl",
        notification.getContext() == null
            ? null
            : notification.getContext().relatedTripId().map(this::tripUrl).orElse(null));
    return context;
  }

  /** Deep link into the web client for a trip. */
  public String tripUrl(String tripId) {
    return UriComponentsBuilder.fromUriString(appBaseUrl)
        .pathSegment("trips", tripId)
        .build()
        .encode()
        .toUriString();
  }
}
