package com.flagship.pharmacy_pos.terminal.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionOpenedEvent implements SessionEvent {
    UUID eventId;
    UUID terminalId;
    UUID sessionId;
    UUID userId;
    BigDecimal openingAmount;
    UUID authorizedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SessionOpened";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SessionOpenedEvent of(UUID terminalId, UUID sessionId, UUID userId,
                                        BigDecimal openingAmount, UUID authorizedBy) {
        return new SessionOpenedEvent(UUID.randomUUID(), terminalId, sessionId, userId,
                openingAmount, authorizedBy, Instant.now());
    }
}
