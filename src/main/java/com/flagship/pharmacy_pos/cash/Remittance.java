package com.flagship.pharmacy_pos.cash;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Cash withdrawn from a drawer at close, waiting to be received by treasury.
 */
@Value
@Builder
public class Remittance {

    public static final String PENDING_RECEIPT = "PENDING_RECEIPT";

    UUID id;
    UUID locationId;
    UUID sourceTerminalId;
    UUID sessionId;
    BigDecimal amount;
    String status;
    UUID createdBy;
    Instant createdAt;
}
