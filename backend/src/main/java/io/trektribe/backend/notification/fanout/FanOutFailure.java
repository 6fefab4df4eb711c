package io.trektribe.backend.notification.fanout;

public record FanOutFailure(String recipientId, FanOutErrorKind errorKind, String message) {}
