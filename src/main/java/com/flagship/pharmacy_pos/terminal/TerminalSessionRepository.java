package com.flagship.pharmacy_pos.terminal;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TerminalSessionRepository {

    void insert(TerminalSession session);

    Optional<TerminalSession> findById(UUID id);

    Optional<TerminalSession> findOpenByTerminalAndUser(UUID terminalId, UUID userId);

    Optional<TerminalSession> findOpenByTerminal(UUID terminalId);

    List<TerminalSession> findOpenByUser(UUID userId);

    /**
     * @return rows updated; 0 when the session was no longer OPEN
     */
    int close(UUID sessionId, SessionClosure closure);

    /**
     * Most recent session on the terminal closed normally or by the system.
     * Force-closed sessions are skipped because their counts were never taken.
     */
    Optional<TerminalSession> findLastCountedClose(UUID terminalId);

    /**
     * OPEN sessions on terminals that are not OPEN ("orphans").
     */
    List<TerminalSession> findOpenOnClosedTerminals();

    List<TerminalSession> findOpenedBefore(Instant cutoff);
}
