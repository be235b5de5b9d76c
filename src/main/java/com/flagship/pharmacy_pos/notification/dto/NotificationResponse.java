package com.flagship.pharmacy_pos.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_pos.notification.Notification;
import com.flagship.pharmacy_pos.notification.NotificationType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class NotificationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    NotificationType type;

    @JsonProperty("title")
    String title;

    @JsonProperty("message")
    String message;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("read_at")
    Instant readAt;

    public static NotificationResponse from(Notification notification) {
        return NotificationResponse.builder()
            .id(notification.getId())
            .type(notification.getType())
            .title(notification.getTitle())
            .message(notification.getMessage())
            .createdAt(notification.getCreatedAt())
            .readAt(notification.getReadAt())
            .build();
    }
}
