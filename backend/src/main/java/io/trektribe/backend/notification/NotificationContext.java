package io.trektribe.backend.notification;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Optional;

/**
 * Auxiliary payload attached to a notification. Each {@link NotificationKind} carries exactly one
 * variant, so a trip notification always has a trip id and title.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "variant")
@JsonSubTypes({
  @JsonSubTypes.Type(value = TripContext.class, name = "trip"),
  @JsonSubTypes.Type(value = SystemContext.class, name = "system")
})
public sealed interface NotificationContext permits TripContext, SystemContext {

  /** The trip this notification links to, used for the email deep link. */
  Optional<String> relatedTripId();
}
