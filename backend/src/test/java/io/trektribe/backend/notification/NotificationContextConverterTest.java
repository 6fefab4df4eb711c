package io.trektribe.backend.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.trektribe.backend.exception.ValidationFailedException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NotificationContextConverterTest {

  private final NotificationContextConverter converter = new NotificationContextConverter();

  @Test
  void tripContextSurvivesStorage() {
    var context = new TripContext("trip-9", "Sahara Crossing", "org-1", "Omar", List.of("price"));

    var json = converter.convertToDatabaseColumn(context);

    assertThat(json).contains("\"variant\":\"trip\"").contains("\"tripTitle\":\"Sahara Crossing\"");
    assertThat(converter.convertToEntityAttribute(json)).isEqualTo(context);
  }

  @Test
  void systemAttributesAreWrittenInKeyOrder() {
    var context = new SystemContext(Map.of("zeta", "1", "alpha", "2", "mid", "3"));

    var json = converter.convertToDatabaseColumn(context);

    assertThat(json.indexOf("alpha")).isLessThan(json.indexOf("mid"));
    assertThat(json.indexOf("mid")).isLessThan(json.indexOf("zeta"));
    assertThat(converter.convertToEntityAttribute(json)).isEqualTo(context);
  }

  @Test
  void nullAndBlankMapToNull() {
    assertThat(converter.convertToDatabaseColumn(null)).isNull();
    assertThat(converter.convertToEntityAttribute(null)).isNull();
    assertThat(converter.convertToEntityAttribute(" ")).isNull();
  }

  @Test
  void tripContextRequiresIdAndTitle() {
    assertThatThrownBy(() -> new TripContext(null, "Alps", null, null))
        .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> new TripContext("trip-1", null, null, null))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  void kindsParseFromWireValues() {
    assertThat(NotificationKind.fromWireValue("trip_delete"))
        .isEqualTo(NotificationKind.TRIP_DELETE);
    assertThat(NotificationKind.fromWireValue(" SYSTEM ")).isEqualTo(NotificationKind.SYSTEM);
    assertThatThrownBy(() -> NotificationKind.fromWireValue("trip_archive"))
        .isInstanceOf(ValidationFailedException.class);
  }

  @Test
  void eachKindAcceptsOnlyItsVariant() {
    var trip = new TripContext("trip-1", "Alps", null, null);
    var system = SystemContext.empty();

    assertThat(NotificationKind.TRIP_REMINDER.accepts(trip)).isTrue();
    assertThat(NotificationKind.TRIP_REMINDER.accepts(system)).isFalse();
    assertThat(NotificationKind.SYSTEM.accepts(system)).isTrue();
    assertThat(NotificationKind.SYSTEM.accepts(trip)).isFalse();
  }
}
