package com.flagship.pharmacy_pos.terminal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_pos.terminal.RepairReport;
import lombok.Value;

@Value
public class RepairResponse {

    @JsonProperty("terminals_released")
    int terminalsReleased;

    @JsonProperty("sessions_closed")
    int sessionsClosed;

    @JsonProperty("skipped")
    int skipped;

    public static RepairResponse from(RepairReport report) {
        return new RepairResponse(report.getTerminalsReleased(), report.getSessionsClosed(), report.getSkipped());
    }
}
