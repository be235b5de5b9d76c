package com.flagship.pharmacy_pos.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable row of {@code audit_log}. Snapshots are kept as JSON text.
 */
@Value
@Builder
public class AuditRecord {
    UUID id;
    UUID userId;
    String userName;
    String userRole;
    UUID sessionId;
    UUID terminalId;
    UUID locationId;
    AuditAction action;
    AuditEntityType entityType;
    String entityId;
    String oldValues;
    String newValues;
    String justification;
    UUID authorizedBy;
    Instant createdAt;
}
