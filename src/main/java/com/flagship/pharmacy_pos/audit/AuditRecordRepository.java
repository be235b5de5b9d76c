package com.flagship.pharmacy_pos.audit;

import java.util.List;

/**
 * Append-only store for audit records. There is deliberately no update or delete.
 */
public interface AuditRecordRepository {

    void insert(AuditRecord record);

    List<AuditRecord> findByEntity(AuditEntityType entityType, String entityId);

    List<AuditRecord> findByAction(AuditAction action);
}
