package com.flagship.pharmacy_pos.terminal;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Opening float suggestion taken from the last counted close of the terminal.
 */
@Value
public class SuggestedOpening {
    BigDecimal amount;
    UUID lastUserId;
    String lastUserName;
    Instant lastClosedAt;

    public static SuggestedOpening none() {
        return new SuggestedOpening(BigDecimal.ZERO, null, null, null);
    }
}
