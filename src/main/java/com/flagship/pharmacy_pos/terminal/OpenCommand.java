package com.flagship.pharmacy_pos.terminal;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Open request. A non-null {@code supervisorPin} makes it the PIN-gated variant.
 */
@Value
@Builder
public class OpenCommand {
    UUID terminalId;
    UUID userId;
    BigDecimal openingAmount;
    String supervisorPin;

    public boolean requiresAuthorization() {
        return supervisorPin != null;
    }
}
