package io.trektribe.backend.notification;

/** Everything needed to create a notification, minus the recipient. */
public record NotificationDraft(
    NotificationKind kind,
    String title,
    String body,
    NotificationContext context,
    boolean wantsEmail) {}
