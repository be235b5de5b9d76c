package com.flagship.pharmacy_pos.terminal.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionClosedEvent implements SessionEvent {
    UUID eventId;
    UUID terminalId;
    UUID sessionId;
    UUID userId;
    BigDecimal closingAmount;
    BigDecimal withdrawalAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SessionClosed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SessionClosedEvent of(UUID terminalId, UUID sessionId, UUID userId,
                                        BigDecimal closingAmount, BigDecimal withdrawalAmount) {
        return new SessionClosedEvent(UUID.randomUUID(), terminalId, sessionId, userId,
                closingAmount, withdrawalAmount, Instant.now());
    }
}
