package com.flagship.pharmacy_pos.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_pos.account.AccountLockState;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AccountLockResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("failure_count")
    int failureCount;

    @JsonProperty("locked_until")
    Instant lockedUntil;

    @JsonProperty("locked_permanently")
    boolean lockedPermanently;

    public static AccountLockResponse from(AccountLockState state) {
        return new AccountLockResponse(state.getUserId(), state.getFailureCount(), state.getLockedUntil(),
            state.isLockedPermanently());
    }
}
