package com.flagship.pharmacy_pos.terminal;

public enum SessionStatus {
    OPEN,
    /** Normal close by the cashier who opened it. */
    CLOSED,
    /** Closed by the system: ghost cleanup, orphan repair or the stale-session sweeper. */
    CLOSED_AUTO,
    /** Closed by an administrator override. */
    CLOSED_FORCE;

    public boolean isClosed() {
        return this != OPEN;
    }
}
