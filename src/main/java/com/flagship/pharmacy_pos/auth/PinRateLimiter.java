package com.flagship.pharmacy_pos.auth;

import java.util.UUID;

/**
 * Failed-PIN throttling per principal.
 */
public interface PinRateLimiter {

    boolean isAllowed(UUID subjectId);

    void recordFailure(UUID subjectId);

    void reset(UUID subjectId);
}
