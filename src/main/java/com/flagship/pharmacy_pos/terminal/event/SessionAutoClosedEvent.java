package com.flagship.pharmacy_pos.terminal.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A session was closed by the system rather than by its owner. Consumers
 * notify the owner so the closure is never silent.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionAutoClosedEvent implements SessionEvent {
    UUID eventId;
    UUID terminalId;
    String terminalName;
    UUID sessionId;
    UUID sessionOwnerId;
    AutoCloseReason reason;
    /** Terminal whose opening triggered the closure; set only for GHOST_SESSION. */
    UUID triggeredByTerminalId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SessionAutoClosed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
