package io.trektribe.backend.notification;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** Free-form attributes for system notifications, kept in key order. */
public record SystemContext(Map<String, String> attributes) implements NotificationContext {

  public SystemContext {
    attributes =
        attributes == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new TreeMap<>(attributes));
  }

  public static SystemContext empty() {
    return new SystemContext(Map.of());
  }

  @Override
  public Optional<String> relatedTripId() {
    return Optional.empty();
  }
}
