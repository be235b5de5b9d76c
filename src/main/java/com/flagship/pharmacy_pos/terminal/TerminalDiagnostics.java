package com.flagship.pharmacy_pos.terminal;

import lombok.Value;

import java.util.List;

/**
 * Inconsistent terminal state found by {@link TerminalDiagnosticsService}.
 */
@Value
public class TerminalDiagnostics {

    /** Terminals marked OPEN with no OPEN session. */
    List<Terminal> zombieTerminals;

    /** OPEN sessions on terminals that are not OPEN. */
    List<TerminalSession> orphanSessions;

    /** OPEN sessions older than the suspicious threshold; not an inconsistency by themselves. */
    List<TerminalSession> longRunningSessions;

    public boolean isHealthy() {
        return zombieTerminals.isEmpty() && orphanSessions.isEmpty();
    }
}
