package com.flagship.pharmacy_pos.terminal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_pos.terminal.TerminalStatus;
import com.flagship.pharmacy_pos.terminal.TerminalStatusView;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TerminalStatusResponse {

    @JsonProperty("terminal_id")
    UUID terminalId;

    @JsonProperty("name")
    String name;

    @JsonProperty("location_id")
    UUID locationId;

    @JsonProperty("status")
    TerminalStatus status;

    @JsonProperty("occupant_id")
    UUID occupantId;

    @JsonProperty("session_id")
    UUID sessionId;

    @JsonProperty("opened_at")
    Instant openedAt;

    @JsonProperty("opening_amount")
    BigDecimal openingAmount;

    @JsonProperty("ghost")
    boolean ghost;

    public static TerminalStatusResponse from(TerminalStatusView view) {
        return TerminalStatusResponse.builder()
            .terminalId(view.getTerminalId())
            .name(view.getName())
            .locationId(view.getLocationId())
            .status(view.getStatus())
            .occupantId(view.getOccupantId())
            .sessionId(view.getSessionId())
            .openedAt(view.getOpenedAt())
            .openingAmount(view.getOpeningAmount())
            .ghost(view.isGhost())
            .build();
    }
}
