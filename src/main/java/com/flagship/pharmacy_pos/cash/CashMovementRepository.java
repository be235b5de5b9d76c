package com.flagship.pharmacy_pos.cash;

import java.util.List;
import java.util.UUID;

public interface CashMovementRepository {

    void insert(CashMovement movement);

    List<CashMovement> findBySession(UUID sessionId);

    List<CashMovement> findByTerminal(UUID terminalId);
}
