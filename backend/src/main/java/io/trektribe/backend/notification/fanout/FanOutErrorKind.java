package io.trektribe.backend.notification.fanout;

public enum FanOutErrorKind {
  VALIDATION,
  STORE,
  DEADLINE_EXCEEDED,
  UNEXPECTED
}
