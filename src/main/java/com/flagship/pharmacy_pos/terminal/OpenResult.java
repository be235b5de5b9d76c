package com.flagship.pharmacy_pos.terminal;

import lombok.Value;

import java.util.UUID;

@Value
public class OpenResult {
    UUID sessionId;
    /** Supervisor who approved the open; null for a plain open. */
    UUID authorizedById;
    /** True when the request matched an already open session and changed nothing. */
    boolean existing;
}
