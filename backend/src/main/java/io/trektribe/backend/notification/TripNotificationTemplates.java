package io.trektribe.backend.notification;

import java.util.List;

/** Title, body and context wording for trip events. */
public final class TripNotificationTemplates {

  private TripNotificationTemplates() {}

  public static NotificationDraft tripJoined(
      String tripId, String tripTitle, String travelerId, String travelerName, int participants) {
    return new NotificationDraft(
        NotificationKind.TRIP_JOIN,
        "New Traveler Joined Your Trip",
        "%s has joined your trip \"%s\". You now have %d participants."
            .formatted(travelerName, tripTitle, participants),
        new TripContext(tripId, tripTitle, travelerId, travelerName),
        true);
  }

  public static NotificationDraft tripLeft(
      String tripId, String tripTitle, String travelerId, String travelerName, int participants) {
    return new NotificationDraft(
        NotificationKind.TRIP_LEAVE,
        "Traveler Left Your Trip",
        "%s has left your trip \"%s\". You now have %d participants."
            .formatted(travelerName, tripTitle, participants),
        new TripContext(tripId, tripTitle, travelerId, travelerName),
        true);
  }

  public static NotificationDraft tripUpdated(
      String tripId,
      String tripTitle,
      String organizerId,
      String organizerName,
      List<String> changes) {
    return new NotificationDraft(
        NotificationKind.TRIP_UPDATE,
        "Trip Updated",
        "The trip \"%s\" has been updated by %s. Changes: %s"
            .formatted(tripTitle, organizerName, String.join(", ", changes)),
        new TripContext(tripId, tripTitle, organizerId, organizerName, changes),
        false);
  }

  public static NotificationDraft tripDeleted(
      String tripId, String tripTitle, String organizerId, String organizerName) {
    return new NotificationDraft(
        NotificationKind.TRIP_DELETE,
        "Trip Cancelled",
        ("The trip \"%s\" has been cancelled by the organizer %s."
                + " We apologize for any inconvenience.")
            .formatted(tripTitle, organizerName),
        new TripContext(tripId, tripTitle, organizerId, organizerName),
        true);
  }

  public static NotificationDraft tripReminder(
      String tripId, String tripTitle, long daysUntilStart) {
    String when =
        daysUntilStart <= 0
            ? "today"
            : daysUntilStart == 1 ? "tomorrow" : "in " + daysUntilStart + " days";
    return new NotificationDraft(
        NotificationKind.TRIP_REMINDER,
        "Trip Reminder",
        "Your trip \"%s\" starts %s.".formatted(tripTitle, when),
        new TripContext(tripId, tripTitle, null, null),
        true);
  }
}
