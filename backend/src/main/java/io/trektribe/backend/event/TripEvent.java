package io.trektribe.backend.event;

import java.time.Instant;

/**
 * Trip-level events published by the trip layer through Spring's ApplicationEventPublisher. All
 * implementations are records with plain fields only, so they stay valid after the publishing
 * transaction commits.
 */
public sealed interface TripEvent
    permits TripJoinedEvent, TripLeftEvent, TripUpdatedEvent, TripDeletedEvent {

  String tripId();

  String tripTitle();

  String actorId();

  String actorName();

  Instant occurredAt();
}
