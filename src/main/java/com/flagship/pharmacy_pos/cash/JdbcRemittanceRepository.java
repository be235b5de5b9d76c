package com.flagship.pharmacy_pos.cash;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

@Repository
public class JdbcRemittanceRepository implements RemittanceRepository {

    private static final RowMapper<Remittance> ROW_MAPPER = (rs, rowNum) -> Remittance.builder()
        .id(rs.getObject("id", UUID.class))
        .locationId(rs.getObject("location_id", UUID.class))
        .sourceTerminalId(rs.getObject("source_terminal_id", UUID.class))
        .sessionId(rs.getObject("session_id", UUID.class))
        .amount(rs.getBigDecimal("amount"))
        .status(rs.getString("status"))
        .createdBy(rs.getObject("created_by", UUID.class))
        .createdAt(rs.getTimestamp("created_at").toInstant())
        .build();

    private final JdbcTemplate jdbcTemplate;

    public JdbcRemittanceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insert(Remittance remittance) {
        jdbcTemplate.update(
            "INSERT INTO treasury_remittances (id, location_id, source_terminal_id, session_id, amount, status, created_by, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            remittance.getId(),
            remittance.getLocationId(),
            remittance.getSourceTerminalId(),
            remittance.getSessionId(),
            remittance.getAmount(),
            remittance.getStatus(),
            remittance.getCreatedBy(),
            Timestamp.from(remittance.getCreatedAt())
        );
    }

    @Override
    public List<Remittance> findByTerminal(UUID terminalId) {
        return jdbcTemplate.query(
            "SELECT * FROM treasury_remittances WHERE source_terminal_id = ? ORDER BY created_at",
            ROW_MAPPER, terminalId);
    }
}
