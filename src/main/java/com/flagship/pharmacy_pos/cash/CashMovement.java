package com.flagship.pharmacy_pos.cash;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only cash ledger entry. A database trigger rejects updates and deletes.
 */
@Value
@Builder
public class CashMovement {
    UUID id;
    UUID locationId;
    UUID terminalId;
    UUID sessionId;
    UUID userId;
    CashMovementType type;
    BigDecimal amount;
    String reason;
    Instant createdAt;
}
