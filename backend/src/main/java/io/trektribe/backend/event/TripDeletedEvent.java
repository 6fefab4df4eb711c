package io.trektribe.backend.event;

import java.time.Instant;
import java.util.List;

/** The organizer cancelled the trip. The participant list is captured before deletion. */
public record TripDeletedEvent(
    String tripId,
    String tripTitle,
    String actorId,
    String actorName,
    Instant occurredAt,
    List<String> participantIds)
    implements TripEvent {}
