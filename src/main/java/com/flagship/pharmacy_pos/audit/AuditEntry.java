package com.flagship.pharmacy_pos.audit;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * What the caller wants recorded. A null actor id means the system itself
 * (sweeper, automatic lock) performed the action.
 */
@Value
@Builder
public class AuditEntry {
    UUID actorId;
    String actorName;
    String actorRole;
    AuditAction action;
    AuditEntityType entityType;
    String entityId;
    Map<String, Object> oldValues;
    Map<String, Object> newValues;
    String justification;
    UUID sessionId;
    UUID terminalId;
    UUID locationId;
    UUID authorizedBy;
}
