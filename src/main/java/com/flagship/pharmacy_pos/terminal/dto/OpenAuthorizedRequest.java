package com.flagship.pharmacy_pos.terminal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Open on behalf of a cashier who needs a supervisor's approval.
 */
@Value
public class OpenAuthorizedRequest {

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    UUID userId;

    @NotNull(message = "Opening amount is required")
    @DecimalMin(value = "0", message = "Opening amount must not be negative")
    @JsonProperty("opening_amount")
    BigDecimal openingAmount;

    @NotBlank(message = "Supervisor PIN is required")
    @Pattern(regexp = "^\\d{4,8}$", message = "PIN must be 4 to 8 digits")
    @JsonProperty("supervisor_pin")
    String supervisorPin;
}
