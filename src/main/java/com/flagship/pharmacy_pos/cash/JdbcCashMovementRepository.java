package com.flagship.pharmacy_pos.cash;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

@Repository
public class JdbcCashMovementRepository implements CashMovementRepository {

    private static final RowMapper<CashMovement> ROW_MAPPER = (rs, rowNum) -> CashMovement.builder()
        .id(rs.getObject("id", UUID.class))
        .locationId(rs.getObject("location_id", UUID.class))
        .terminalId(rs.getObject("terminal_id", UUID.class))
        .sessionId(rs.getObject("session_id", UUID.class))
        .userId(rs.getObject("user_id", UUID.class))
        .type(CashMovementType.valueOf(rs.getString("type")))
        .amount(rs.getBigDecimal("amount"))
        .reason(rs.getString("reason"))
        .createdAt(rs.getTimestamp("created_at").toInstant())
        .build();

    private final JdbcTemplate jdbcTemplate;

    public JdbcCashMovementRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insert(CashMovement movement) {
        jdbcTemplate.update(
            "INSERT INTO cash_movements (id, location_id, terminal_id, session_id, user_id, type, amount, reason, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            movement.getId(),
            movement.getLocationId(),
            movement.getTerminalId(),
            movement.getSessionId(),
            movement.getUserId(),
            movement.getType().name(),
            movement.getAmount(),
            movement.getReason(),
            Timestamp.from(movement.getCreatedAt())
        );
    }

    @Override
    public List<CashMovement> findBySession(UUID sessionId) {
        return jdbcTemplate.query(
            "SELECT * FROM cash_movements WHERE session_id = ? ORDER BY created_at, id",
            ROW_MAPPER, sessionId);
    }

    @Override
    public List<CashMovement> findByTerminal(UUID terminalId) {
        return jdbcTemplate.query(
            "SELECT * FROM cash_movements WHERE terminal_id = ? ORDER BY created_at, id",
            ROW_MAPPER, terminalId);
    }
}
