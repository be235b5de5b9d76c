package com.flagship.pharmacy_pos.audit;

public enum AuditEntityType {
    SESSION,
    TERMINAL,
    USER,
    PRODUCT
}
