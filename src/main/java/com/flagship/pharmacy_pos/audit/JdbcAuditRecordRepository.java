package com.flagship.pharmacy_pos.audit;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

@Repository
public class JdbcAuditRecordRepository implements AuditRecordRepository {

    private static final String SELECT_COLUMNS = """
        SELECT id, user_id, user_name, user_role, session_id, terminal_id, location_id,
               action_code, entity_type, entity_id, old_values::text AS old_values,
               new_values::text AS new_values, justification, authorized_by, created_at
        FROM audit_log
        """;

    private static final RowMapper<AuditRecord> ROW_MAPPER = (rs, rowNum) -> AuditRecord.builder()
        .id(rs.getObject("id", UUID.class))
        .userId(rs.getObject("user_id", UUID.class))
        .userName(rs.getString("user_name"))
        .userRole(rs.getString("user_role"))
        .sessionId(rs.getObject("session_id", UUID.class))
        .terminalId(rs.getObject("terminal_id", UUID.class))
        .locationId(rs.getObject("location_id", UUID.class))
        .action(AuditAction.valueOf(rs.getString("action_code")))
        .entityType(AuditEntityType.valueOf(rs.getString("entity_type")))
        .entityId(rs.getString("entity_id"))
        .oldValues(rs.getString("old_values"))
        .newValues(rs.getString("new_values"))
        .justification(rs.getString("justification"))
        .authorizedBy(rs.getObject("authorized_by", UUID.class))
        .createdAt(rs.getTimestamp("created_at").toInstant())
        .build();

    private final JdbcTemplate jdbcTemplate;

    public JdbcAuditRecordRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insert(AuditRecord record) {
        jdbcTemplate.update(
            "INSERT INTO audit_log (id, user_id, user_name, user_role, session_id, terminal_id, location_id, " +
            "action_code, entity_type, entity_id, old_values, new_values, justification, authorized_by, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?)",
            record.getId(),
            record.getUserId(),
            record.getUserName(),
            record.getUserRole(),
            record.getSessionId(),
            record.getTerminalId(),
            record.getLocationId(),
            record.getAction().name(),
            record.getEntityType().name(),
            record.getEntityId(),
            record.getOldValues(),
            record.getNewValues(),
            record.getJustification(),
            record.getAuthorizedBy(),
            Timestamp.from(record.getCreatedAt())
        );
    }

    @Override
    public List<AuditRecord> findByEntity(AuditEntityType entityType, String entityId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE entity_type = ? AND entity_id = ? ORDER BY created_at",
            ROW_MAPPER, entityType.name(), entityId);
    }

    @Override
    public List<AuditRecord> findByAction(AuditAction action) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE action_code = ? ORDER BY created_at",
            ROW_MAPPER, action.name());
    }
}
