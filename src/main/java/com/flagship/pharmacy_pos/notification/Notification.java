package com.flagship.pharmacy_pos.notification;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class Notification {
    UUID id;
    UUID userId;
    NotificationType type;
    String title;
    String message;
    /** Event that produced this notification, if any. */
    UUID sourceEventId;
    Instant createdAt;
    Instant readAt;
}
