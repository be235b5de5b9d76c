package com.flagship.pharmacy_pos.terminal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class RepairRequest {

    @NotNull(message = "Admin ID is required")
    @JsonProperty("admin_id")
    UUID adminId;
}
