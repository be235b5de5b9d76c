package com.flagship.pharmacy_pos.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class UnlockAccountRequest {

    @NotBlank(message = "Admin PIN is required")
    @Pattern(regexp = "^\\d{4,8}$", message = "PIN must be 4 to 8 digits")
    @JsonProperty("admin_pin")
    String adminPin;

    @NotBlank(message = "Reason is required")
    @Size(min = 10, max = 500, message = "Reason must be 10 to 500 characters")
    @JsonProperty("reason")
    String reason;
}
