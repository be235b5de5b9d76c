package com.flagship.pharmacy_pos.pricing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * New sale price, and optionally a new cost price, for a product and all of its batches.
 */
@Value
@Builder
public class ProductPriceUpdate {

    BigDecimal price;

    @Builder.Default
    Optional<BigDecimal> costPrice = Optional.empty();
}
