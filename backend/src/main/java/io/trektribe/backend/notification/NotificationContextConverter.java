package io.trektribe.backend.notification;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * Stores the context as JSON text. Text rather than jsonb keeps the serialized form, and therefore
 * what a client reads back, byte-identical to what was written.
 */
@Converter
public class NotificationContextConverter
    implements AttributeConverter<NotificationContext, String> {

  /** Column width of {@code notifications.context} on every supported database. */
  static final int MAX_SERIALIZED_LENGTH = 8000;

  private static final ObjectMapper MAPPER = JsonMapper.builder().build();

  @Override
  public String convertToDatabaseColumn(NotificationContext context) {
    if (context == null) {
      return null;
    }
    return serialize(context);
  }

  static String serialize(NotificationContext context) {
    try {
      return MAPPER.writeValueAsString(context);
    } catch (JacksonException e) {
      throw new IllegalArgumentException("Unserializable notification context", e);
    }
  }

  @Override
  public NotificationContext convertToEntityAttribute(String json) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return MAPPER.readValue(json, NotificationContext.class);
    } catch (JacksonException e) {
      throw new IllegalStateException("Corrupt notification context: " + json, e);
    }
  }
}
