package com.flagship.pharmacy_pos.audit;

/**
 * Action codes written to {@code audit_log.action_code}.
 */
public enum AuditAction {
    SESSION_OPEN(false),
    SESSION_OPEN_AUTHORIZED(false),
    SESSION_CLOSE(false),
    SESSION_FORCE_CLOSE(true),
    SESSION_AUTO_CLOSE(false),
    PRICE_CHANGE(true),
    ACCOUNT_LOCKED(false),
    ACCOUNT_UNLOCKED(true);

    private final boolean justificationRequired;

    AuditAction(boolean justificationRequired) {
        this.justificationRequired = justificationRequired;
    }

    public boolean isJustificationRequired() {
        return justificationRequired;
    }
}
