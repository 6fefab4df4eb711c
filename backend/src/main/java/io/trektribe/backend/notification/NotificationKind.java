package io.trektribe.backend.notification;

import com.fasterxml.jackson.annotation.JsonValue;
import io.trektribe.backend.exception.ValidationFailedException;
import java.util.Locale;

/** Closed set of notification categories, each with its stable wire value. */
public enum NotificationKind {
  TRIP_JOIN("trip_join"),
  TRIP_LEAVE("trip_leave"),
  TRIP_UPDATE("trip_update"),
  TRIP_DELETE("trip_delete"),
  TRIP_REMINDER("trip_reminder"),
  SYSTEM("system");

  private final String wireValue;

  NotificationKind(String wireValue) {
    this.wireValue = wireValue;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }

  /** Whether a context variant is the one this kind carries. */
  public boolean accepts(NotificationContext context) {
    if (this == SYSTEM) {
      return context instanceof SystemContext;
    }
    return context instanceof TripContext;
  }

  public static NotificationKind fromWireValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (NotificationKind kind : values()) {
        if (kind.wireValue.equals(normalized)) {
          return kind;
        }
      }
    }
    throw new ValidationFailedException(
        "Invalid notification kind", "Unrecognized notification kind: " + value);
  }
}
