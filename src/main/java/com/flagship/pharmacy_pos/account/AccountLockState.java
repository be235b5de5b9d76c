package com.flagship.pharmacy_pos.account;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AccountLockState {
    UUID userId;
    int failureCount;
    Instant lockedUntil;
    boolean lockedPermanently;
}
