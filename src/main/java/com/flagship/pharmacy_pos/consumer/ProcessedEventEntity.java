package com.flagship.pharmacy_pos.consumer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A session event some consumer group has already dealt with. Replayed
 * Kafka deliveries find this row and are dropped.
 */
@Entity
@Table(name = "processed_events")
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProcessedEventEntity {

    public enum Outcome {
        NOTIFIED,
        IGNORED
    }

    @Id
    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "consumer_group", nullable = false, length = 100)
    private String consumerGroup;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "terminal_id", nullable = false)
    private UUID terminalId;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 20)
    private Outcome outcome;

    @Column(name = "note", columnDefinition = "TEXT")
    private String note;

    static ProcessedEventEntity notified(EventEnvelope envelope, String consumerGroup) {
        return of(envelope, consumerGroup, Outcome.NOTIFIED, null);
    }

    static ProcessedEventEntity ignored(EventEnvelope envelope, String consumerGroup, String reason) {
        return of(envelope, consumerGroup, Outcome.IGNORED, reason);
    }

    private static ProcessedEventEntity of(EventEnvelope envelope, String consumerGroup,
                                           Outcome outcome, String note) {
        return ProcessedEventEntity.builder()
                .eventId(envelope.eventId())
                .consumerGroup(consumerGroup)
                .eventType(envelope.eventType())
                .terminalId(envelope.terminalId())
                .processedAt(Instant.now())
                .outcome(outcome)
                .note(note)
                .build();
    }
}
