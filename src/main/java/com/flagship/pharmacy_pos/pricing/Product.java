package com.flagship.pharmacy_pos.pricing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class Product {
    UUID id;
    String sku;
    String name;
    BigDecimal price;
    BigDecimal costPrice;
    Instant updatedAt;
}
