package com.flagship.pharmacy_pos.terminal;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Plain JDBC access to {@code terminals}. Soft-deleted rows are still returned by id.
 */
@Repository
public class JdbcTerminalRepository implements TerminalRepository {

    private static final RowMapper<Terminal> ROW_MAPPER = (rs, rowNum) -> Terminal.builder()
        .id(rs.getObject("id", UUID.class))
        .locationId(rs.getObject("location_id", UUID.class))
        .name(rs.getString("name"))
        .status(TerminalStatus.valueOf(rs.getString("status")))
        .currentOccupantId(rs.getObject("current_cashier_id", UUID.class))
        .updatedAt(rs.getTimestamp("updated_at").toInstant())
        .build();

    private final JdbcTemplate jdbcTemplate;

    public JdbcTerminalRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Terminal> findById(UUID id) {
        return jdbcTemplate.query("SELECT * FROM terminals WHERE id = ?", ROW_MAPPER, id)
            .stream()
            .findFirst();
    }

    @Override
    public void markOpen(UUID terminalId, UUID occupantId) {
        jdbcTemplate.update(
            "UPDATE terminals SET status = 'OPEN', current_cashier_id = ?, updated_at = now() WHERE id = ?",
            occupantId, terminalId);
    }

    @Override
    public void markClosed(UUID terminalId) {
        jdbcTemplate.update(
            "UPDATE terminals SET status = 'CLOSED', current_cashier_id = NULL, updated_at = now() " +
            "WHERE id = ? AND status <> 'DELETED'",
            terminalId);
    }

    @Override
    public List<Terminal> findOpenWithoutSession() {
        return jdbcTemplate.query("""
            SELECT t.* FROM terminals t
            WHERE t.status = 'OPEN'
              AND NOT EXISTS (
                  SELECT 1 FROM cash_register_sessions s
                  WHERE s.terminal_id = t.id AND s.status = 'OPEN')
            ORDER BY t.name
            """, ROW_MAPPER);
    }
}
