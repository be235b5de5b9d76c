package com.flagship.pharmacy_pos.terminal;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class CloseCommand {
    UUID terminalId;
    UUID userId;
    BigDecimal finalCash;
    BigDecimal withdrawalAmount;
    String comments;
}
