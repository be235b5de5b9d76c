package com.flagship.pharmacy_pos.terminal;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Update command moving an OPEN session to a closed status. The note, when
 * present, is appended to the existing notes.
 */
@Value
@Builder
public class SessionClosure {

    SessionStatus status;

    Instant closedAt;

    @Builder.Default
    Optional<BigDecimal> closingAmount = Optional.empty();

    @Builder.Default
    Optional<String> note = Optional.empty();

    public SessionClosure validated() {
        if (status == null || !status.isClosed()) {
            throw new IllegalArgumentException("Closure status must be a closed status, got " + status);
        }
        if (closedAt == null) {
            throw new IllegalArgumentException("closedAt is required");
        }
        return this;
    }
}
