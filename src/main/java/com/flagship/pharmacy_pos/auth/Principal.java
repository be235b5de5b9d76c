package com.flagship.pharmacy_pos.auth;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Read model of a user row. Owned by the identity subsystem; this service
 * only maintains the failure counter and lock columns.
 */
@Value
@Builder
public class Principal {
    UUID id;
    String name;
    Role role;
    boolean active;
    StoredCredential credential;
    int failureCount;
    Instant lockedUntil;
    boolean lockedPermanently;

    public boolean isLockedAt(Instant now) {
        return lockedPermanently || (lockedUntil != null && lockedUntil.isAfter(now));
    }
}
