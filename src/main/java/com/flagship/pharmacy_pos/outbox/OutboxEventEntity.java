package com.flagship.pharmacy_pos.outbox;

import com.flagship.pharmacy_pos.terminal.event.SessionEvent;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "outbox_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEventEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "terminal_id", nullable = false, updatable = false)
    private UUID terminalId;

    @Column(name = "session_id", updatable = false)
    private UUID sessionId;

    @Column(name = "event_type", nullable = false, length = 100, updatable = false)
    private String eventType;

    @Column(name = "payload", nullable = false, columnDefinition = "jsonb", updatable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    // assigned by the BIGSERIAL column, defines publish order
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    static OutboxEventEntity pending(SessionEvent event, String payload) {
        OutboxEventEntity entity = new OutboxEventEntity();
        entity.id = event.getEventId();
        entity.terminalId = event.getTerminalId();
        entity.sessionId = event.getSessionId();
        entity.eventType = event.getEventType();
        entity.payload = payload;
        entity.createdAt = Instant.now();
        return entity;
    }

    OutboxEvent toEvent() {
        return OutboxEvent.builder()
                .id(id)
                .terminalId(terminalId)
                .sessionId(sessionId)
                .eventType(eventType)
                .payload(payload)
                .createdAt(createdAt)
                .publishedAt(publishedAt)
                .attempts(attempts)
                .lastError(lastError)
                .sequenceNumber(sequenceNumber)
                .build();
    }
}
