package com.flagship.pharmacy_pos.outbox;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A session event waiting in the outbox to be shipped to Kafka.
 *
 * The id is the event's own id, so consumers deduplicate on the same value
 * the outbox row carries.
 */
@Value
@Builder
public class OutboxEvent {
    UUID id;
    UUID terminalId;
    /** Null when a terminal with no session was force-closed. */
    UUID sessionId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int attempts;
    String lastError;
    Long sequenceNumber;

    public boolean isPublished() {
        return publishedAt != null;
    }
}
