package com.flagship.pharmacy_pos.terminal.event;

public enum AutoCloseReason {
    /** The owner opened another terminal while this session was still open. */
    GHOST_SESSION,
    /** The session was OPEN on a terminal that was not. */
    ORPHAN_SESSION,
    /** Open longer than the stale threshold. */
    STALE_SESSION
}
