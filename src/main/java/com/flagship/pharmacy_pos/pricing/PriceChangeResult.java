package com.flagship.pharmacy_pos.pricing;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class PriceChangeResult {
    UUID productId;
    BigDecimal oldPrice;
    BigDecimal newPrice;
    /** |new - old| / old as a fraction; 1 when the old price was zero. */
    BigDecimal changeRatio;
    UUID approvedById;
    int batchesUpdated;
}
