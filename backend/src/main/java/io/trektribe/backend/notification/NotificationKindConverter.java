package io.trektribe.backend.notification;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class NotificationKindConverter implements AttributeConverter<NotificationKind, String> {

  @Override
  public String convertToDatabaseColumn(NotificationKind kind) {
    return kind == null ? null : kind.wireValue();
  }

  @Override
  public NotificationKind convertToEntityAttribute(String value) {
    return value == null ? null : NotificationKind.fromWireValue(value);
  }
}
