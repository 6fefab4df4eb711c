package io.trektribe.backend.event;

import java.time.Instant;

/** A traveler left; {@code actorId} is the traveler. */
public record TripLeftEvent(
    String tripId,
    String tripTitle,
    String actorId,
    String actorName,
    Instant occurredAt,
    String organizerId,
    int participantCount)
    implements TripEvent {}
