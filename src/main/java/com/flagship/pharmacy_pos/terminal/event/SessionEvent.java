package com.flagship.pharmacy_pos.terminal.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for terminal session events written to the outbox.
 *
 * Events are keyed by terminal so a consumer sees each terminal's
 * history in order.
 */
public interface SessionEvent {

    /**
     * Unique identifier for this event instance, used for consumer deduplication.
     */
    UUID getEventId();

    UUID getTerminalId();

    /**
     * Null for events about a terminal that had no session (a stuck terminal force-closed).
     */
    UUID getSessionId();

    Instant getOccurredAt();

    String getEventType();
}
