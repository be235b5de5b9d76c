package com.flagship.pharmacy_pos.terminal;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A physical POS device. {@code currentOccupantId} is set if and only if the
 * terminal is OPEN (enforced by a check constraint as well).
 */
@Value
@Builder
public class Terminal {
    UUID id;
    UUID locationId;
    String name;
    TerminalStatus status;
    UUID currentOccupantId;
    Instant updatedAt;

    public boolean isOpen() {
        return status == TerminalStatus.OPEN;
    }

    public boolean isDeleted() {
        return status == TerminalStatus.DELETED;
    }
}
