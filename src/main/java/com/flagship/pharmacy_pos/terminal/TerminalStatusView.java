package com.flagship.pharmacy_pos.terminal;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Terminal row joined with its OPEN session, if any.
 */
@Value
@Builder
public class TerminalStatusView {
    UUID terminalId;
    String name;
    UUID locationId;
    TerminalStatus status;
    UUID occupantId;
    UUID sessionId;
    Instant openedAt;
    BigDecimal openingAmount;

    /** OPEN terminal without an OPEN session; needs a force-close. */
    public boolean isGhost() {
        return status == TerminalStatus.OPEN && sessionId == null;
    }
}
