package com.flagship.pharmacy_pos.pricing.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class PriceChangeRequest {

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    UUID userId;

    @NotNull(message = "New price is required")
    @DecimalMin(value = "0", message = "Price must not be negative")
    @JsonProperty("new_price")
    BigDecimal newPrice;

    @DecimalMin(value = "0", message = "Cost price must not be negative")
    @JsonProperty("new_cost_price")
    BigDecimal newCostPrice;

    @NotBlank(message = "Reason is required")
    @Size(min = 10, max = 500, message = "Reason must be 10 to 500 characters")
    @JsonProperty("reason")
    String reason;

    @Pattern(regexp = "^\\d{4,8}$", message = "PIN must be 4 to 8 digits")
    @JsonProperty("manager_pin")
    String managerPin;
}
