package com.flagship.pharmacy_pos.notification;

public enum NotificationType {
    SESSION_AUTO_CLOSED,
    SESSION_FORCE_CLOSED
}
