package com.flagship.pharmacy_pos.terminal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_pos.terminal.Terminal;
import com.flagship.pharmacy_pos.terminal.TerminalDiagnostics;
import com.flagship.pharmacy_pos.terminal.TerminalSession;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class DiagnosticsResponse {

    @JsonProperty("healthy")
    boolean healthy;

    @JsonProperty("zombie_terminals")
    List<TerminalItem> zombieTerminals;

    @JsonProperty("orphan_sessions")
    List<SessionItem> orphanSessions;

    @JsonProperty("long_running_sessions")
    List<SessionItem> longRunningSessions;

    public static DiagnosticsResponse from(TerminalDiagnostics diagnostics) {
        return new DiagnosticsResponse(
            diagnostics.isHealthy(),
            diagnostics.getZombieTerminals().stream().map(TerminalItem::from).toList(),
            diagnostics.getOrphanSessions().stream().map(SessionItem::from).toList(),
            diagnostics.getLongRunningSessions().stream().map(SessionItem::from).toList());
    }

    @Value
    public static class TerminalItem {
        @JsonProperty("terminal_id")
        UUID terminalId;
        @JsonProperty("name")
        String name;
        @JsonProperty("occupant_id")
        UUID occupantId;

        static TerminalItem from(Terminal terminal) {
            return new TerminalItem(terminal.getId(), terminal.getName(), terminal.getCurrentOccupantId());
        }
    }

    @Value
    public static class SessionItem {
        @JsonProperty("session_id")
        UUID sessionId;
        @JsonProperty("terminal_id")
        UUID terminalId;
        @JsonProperty("user_id")
        UUID userId;
        @JsonProperty("opened_at")
        Instant openedAt;

        static SessionItem from(TerminalSession session) {
            return new SessionItem(session.getId(), session.getTerminalId(), session.getUserId(),
                session.getOpenedAt());
        }
    }
}
