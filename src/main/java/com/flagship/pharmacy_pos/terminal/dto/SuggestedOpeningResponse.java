package com.flagship.pharmacy_pos.terminal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_pos.terminal.SuggestedOpening;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class SuggestedOpeningResponse {

    @JsonProperty("suggested_amount")
    BigDecimal suggestedAmount;

    @JsonProperty("last_user_id")
    UUID lastUserId;

    @JsonProperty("last_user_name")
    String lastUserName;

    @JsonProperty("last_closed_at")
    Instant lastClosedAt;

    public static SuggestedOpeningResponse from(SuggestedOpening suggestion) {
        return new SuggestedOpeningResponse(suggestion.getAmount(), suggestion.getLastUserId(),
            suggestion.getLastUserName(), suggestion.getLastClosedAt());
    }
}
