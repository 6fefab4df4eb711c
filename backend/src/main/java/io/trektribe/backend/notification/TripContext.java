package io.trektribe.backend.notification;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record TripContext(
    String tripId, String tripTitle, String actorId, String actorName, List<String> changes)
    implements NotificationContext {

  public TripContext {
    Objects.requireNonNull(tripId, "tripId must not be null");
    Objects.requireNonNull(tripTitle, "tripTitle must not be null");
    changes = changes == null ? List.of() : List.copyOf(changes);
  }

  public TripContext(String tripId, String tripTitle, String actorId, String actorName) {
    this(tripId, tripTitle, actorId, actorName, List.of());
  }

  @Override
  public Optional<String> relatedTripId() {
    return Optional.of(tripId);
  }
}
