package com.flagship.pharmacy_pos.auth;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Partial update of the lock-related columns of a user. Absent fields are
 * left untouched; {@code clearLock} resets both lock columns.
 */
@Value
@Builder
public class PrincipalSecurityUpdate {

    @Builder.Default
    Optional<Integer> failureCount = Optional.empty();

    @Builder.Default
    Optional<Instant> lockedUntil = Optional.empty();

    @Builder.Default
    Optional<Boolean> lockedPermanently = Optional.empty();

    boolean clearLock;

    public boolean isEmpty() {
        return failureCount.isEmpty() && lockedUntil.isEmpty() && lockedPermanently.isEmpty() && !clearLock;
    }

    public static PrincipalSecurityUpdate unlocked() {
        return PrincipalSecurityUpdate.builder()
                .failureCount(Optional.of(0))
                .clearLock(true)
                .build();
    }
}
