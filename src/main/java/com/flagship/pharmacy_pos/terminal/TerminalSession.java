package com.flagship.pharmacy_pos.terminal;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One cashier's occupancy of a terminal. Rows are never deleted, only moved
 * from OPEN to one of the closed statuses.
 */
@Value
@Builder
public class TerminalSession {
    UUID id;
    UUID terminalId;
    UUID userId;
    BigDecimal openingAmount;
    BigDecimal closingAmount;
    SessionStatus status;
    Instant openedAt;
    Instant closedAt;
    UUID authorizedBy;
    String notes;

    public static TerminalSession open(UUID id, UUID terminalId, UUID userId,
                                       BigDecimal openingAmount, UUID authorizedBy, Instant openedAt) {
        return TerminalSession.builder()
            .id(id)
            .terminalId(terminalId)
            .userId(userId)
            .openingAmount(openingAmount)
            .status(SessionStatus.OPEN)
            .openedAt(openedAt)
            .authorizedBy(authorizedBy)
            .build();
    }
}
