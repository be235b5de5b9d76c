package com.flagship.pharmacy_pos.terminal;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class ForceCloseCommand {
    UUID terminalId;
    UUID adminId;
    String justification;
}
