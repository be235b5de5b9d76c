package com.flagship.pharmacy_pos.terminal.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionForceClosedEvent implements SessionEvent {
    UUID eventId;
    UUID terminalId;
    UUID sessionId;
    UUID sessionOwnerId;
    UUID adminId;
    String justification;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SessionForceClosed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SessionForceClosedEvent of(UUID terminalId, UUID sessionId, UUID sessionOwnerId,
                                             UUID adminId, String justification) {
        return new SessionForceClosedEvent(UUID.randomUUID(), terminalId, sessionId, sessionOwnerId,
                adminId, justification, Instant.now());
    }
}
