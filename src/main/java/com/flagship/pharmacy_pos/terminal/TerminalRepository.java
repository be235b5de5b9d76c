package com.flagship.pharmacy_pos.terminal;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Terminal rows. Status and occupant are written only by the session engine.
 */
public interface TerminalRepository {

    Optional<Terminal> findById(UUID id);

    void markOpen(UUID terminalId, UUID occupantId);

    void markClosed(UUID terminalId);

    /**
     * Terminals marked OPEN that have no OPEN session ("zombies").
     */
    List<Terminal> findOpenWithoutSession();
}
