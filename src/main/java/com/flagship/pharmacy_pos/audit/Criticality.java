package com.flagship.pharmacy_pos.audit;

/**
 * How an audit write failure affects the caller.
 */
public enum Criticality {
    /** Written in the caller's transaction; a failure aborts the whole operation. */
    MANDATORY,
    /** Failure is logged and counted, the caller's transaction carries on. */
    BEST_EFFORT
}
