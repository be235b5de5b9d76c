package com.flagship.pharmacy_pos.terminal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class OpenTerminalRequest {

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    UUID userId;

    @NotNull(message = "Opening amount is required")
    @DecimalMin(value = "0", message = "Opening amount must not be negative")
    @JsonProperty("opening_amount")
    BigDecimal openingAmount;
}
