package com.birthdayreminder.scheduler.domain.notification;

public enum NotificationType {
    BIRTHDAY,
    REMINDER,
    SYSTEM,
    UPDATE
}
