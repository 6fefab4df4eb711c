package io.trektribe.backend.event;

import java.time.Instant;

/** A traveler joined; {@code actorId} is the traveler. */
public record TripJoinedEvent(
    String tripId,
    String tripTitle,
    String actorId,
    String actorName,
    Instant occurredAt,
    String organizerId,
    int participantCount)
    implements TripEvent {}
