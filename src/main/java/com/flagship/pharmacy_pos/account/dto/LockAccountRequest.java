package com.flagship.pharmacy_pos.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class LockAccountRequest {

    @NotNull(message = "Admin ID is required")
    @JsonProperty("admin_id")
    UUID adminId;

    @NotBlank(message = "Reason is required")
    @Size(min = 10, max = 500, message = "Reason must be 10 to 500 characters")
    @JsonProperty("reason")
    String reason;
}
