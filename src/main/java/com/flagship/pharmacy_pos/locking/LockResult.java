package com.flagship.pharmacy_pos.locking;

public enum LockResult {
    LOCKED,
    NOT_FOUND,
    /** Held by another unit of work. The current transaction is now aborted and must roll back. */
    BUSY
}
