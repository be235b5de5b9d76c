package com.flagship.pharmacy_pos.pricing.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_pos.pricing.PriceChangeResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class PriceChangeResponse {

    @JsonProperty("product_id")
    UUID productId;

    @JsonProperty("old_price")
    BigDecimal oldPrice;

    @JsonProperty("new_price")
    BigDecimal newPrice;

    @JsonProperty("change_ratio")
    BigDecimal changeRatio;

    @JsonProperty("approved_by_id")
    UUID approvedById;

    @JsonProperty("batches_updated")
    int batchesUpdated;

    public static PriceChangeResponse from(PriceChangeResult result) {
        return PriceChangeResponse.builder()
            .productId(result.getProductId())
            .oldPrice(result.getOldPrice())
            .newPrice(result.getNewPrice())
            .changeRatio(result.getChangeRatio())
            .approvedById(result.getApprovedById())
            .batchesUpdated(result.getBatchesUpdated())
            .build();
    }
}
