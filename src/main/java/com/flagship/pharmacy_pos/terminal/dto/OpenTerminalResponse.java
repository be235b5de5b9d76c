package com.flagship.pharmacy_pos.terminal.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_pos.terminal.OpenResult;
import lombok.Value;

import java.util.UUID;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OpenTerminalResponse {

    @JsonProperty("session_id")
    UUID sessionId;

    @JsonProperty("authorized_by_id")
    UUID authorizedById;

    @JsonProperty("existing")
    boolean existing;

    public static OpenTerminalResponse from(OpenResult result) {
        return new OpenTerminalResponse(result.getSessionId(), result.getAuthorizedById(), result.isExisting());
    }
}
