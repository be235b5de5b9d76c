package com.flagship.pharmacy_pos.pricing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class PriceChangeCommand {
    UUID productId;
    UUID actorId;
    BigDecimal newPrice;
    BigDecimal newCostPrice;
    String reason;
    /** Required only when the change exceeds the approval threshold. */
    String managerPin;
}
