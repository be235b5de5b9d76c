package com.flagship.pharmacy_pos.terminal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CloseTerminalRequest {

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    UUID userId;

    @NotNull(message = "Final cash is required")
    @DecimalMin(value = "0", message = "Final cash must not be negative")
    @JsonProperty("final_cash")
    BigDecimal finalCash;

    @DecimalMin(value = "0", message = "Withdrawal amount must not be negative")
    @JsonProperty("withdrawal_amount")
    BigDecimal withdrawalAmount;

    @Size(max = 500, message = "Comments must be at most 500 characters")
    @JsonProperty("comments")
    String comments;
}
