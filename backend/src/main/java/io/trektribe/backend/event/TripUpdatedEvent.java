package io.trektribe.backend.event;

import java.time.Instant;
import java.util.List;

public record TripUpdatedEvent(
    String tripId,
    String tripTitle,
    String actorId,
    String actorName,
    Instant occurredAt,
    List<String> participantIds,
    List<String> changedFields)
    implements TripEvent {}
