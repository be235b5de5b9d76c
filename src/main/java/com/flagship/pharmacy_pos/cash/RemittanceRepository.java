package com.flagship.pharmacy_pos.cash;

import java.util.List;
import java.util.UUID;

public interface RemittanceRepository {

    void insert(Remittance remittance);

    List<Remittance> findByTerminal(UUID terminalId);
}
