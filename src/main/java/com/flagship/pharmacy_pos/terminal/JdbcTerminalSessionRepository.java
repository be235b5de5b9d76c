package com.flagship.pharmacy_pos.terminal;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link TerminalSessionRepository} over {@code cash_register_sessions}.
 * Row locks are taken by the lock coordinator, not here.
 */
@Repository
public class JdbcTerminalSessionRepository implements TerminalSessionRepository {

    private static final RowMapper<TerminalSession> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp closedAt = rs.getTimestamp("closed_at");
        return TerminalSession.builder()
            .id(rs.getObject("id", UUID.class))
            .terminalId(rs.getObject("terminal_id", UUID.class))
            .userId(rs.getObject("user_id", UUID.class))
            .openingAmount(rs.getBigDecimal("opening_amount"))
            .closingAmount(rs.getBigDecimal("closing_amount"))
            .status(SessionStatus.valueOf(rs.getString("status")))
            .openedAt(rs.getTimestamp("opened_at").toInstant())
            .closedAt(closedAt != null ? closedAt.toInstant() : null)
            .authorizedBy(rs.getObject("authorized_by", UUID.class))
            .notes(rs.getString("notes"))
            .build();
    };

    private final JdbcTemplate jdbcTemplate;

    public JdbcTerminalSessionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insert(TerminalSession session) {
        jdbcTemplate.update(
            "INSERT INTO cash_register_sessions (id, terminal_id, user_id, opening_amount, status, opened_at, authorized_by, notes) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            session.getId(),
            session.getTerminalId(),
            session.getUserId(),
            session.getOpeningAmount(),
            session.getStatus().name(),
            Timestamp.from(session.getOpenedAt()),
            session.getAuthorizedBy(),
            session.getNotes()
        );
    }

    @Override
    public Optional<TerminalSession> findById(UUID id) {
        return first("SELECT * FROM cash_register_sessions WHERE id = ?", id);
    }

    @Override
    public Optional<TerminalSession> findOpenByTerminalAndUser(UUID terminalId, UUID userId) {
        return first(
            "SELECT * FROM cash_register_sessions WHERE terminal_id = ? AND user_id = ? AND status = 'OPEN'",
            terminalId, userId);
    }

    @Override
    public Optional<TerminalSession> findOpenByTerminal(UUID terminalId) {
        return first(
            "SELECT * FROM cash_register_sessions WHERE terminal_id = ? AND status = 'OPEN'",
            terminalId);
    }

    @Override
    public List<TerminalSession> findOpenByUser(UUID userId) {
        return jdbcTemplate.query(
            "SELECT * FROM cash_register_sessions WHERE user_id = ? AND status = 'OPEN' ORDER BY opened_at",
            ROW_MAPPER, userId);
    }

    @Override
    public int close(UUID sessionId, SessionClosure closure) {
        closure.validated();
        String note = closure.getNote().orElse(null);
        return jdbcTemplate.update(
            "UPDATE cash_register_sessions SET status = ?, closed_at = ?, " +
            "closing_amount = COALESCE(?, closing_amount), " +
            "notes = CASE WHEN ?::text IS NULL THEN notes " +
            "             WHEN notes IS NULL OR notes = '' THEN ?::text " +
            "             ELSE notes || ' | ' || ?::text END " +
            "WHERE id = ? AND status = 'OPEN'",
            closure.getStatus().name(),
            Timestamp.from(closure.getClosedAt()),
            closure.getClosingAmount().orElse(null),
            note, note, note,
            sessionId
        );
    }

    @Override
    public Optional<TerminalSession> findLastCountedClose(UUID terminalId) {
        return first("""
            SELECT * FROM cash_register_sessions
            WHERE terminal_id = ? AND status IN ('CLOSED', 'CLOSED_AUTO') AND closed_at IS NOT NULL
            ORDER BY closed_at DESC
            LIMIT 1
            """, terminalId);
    }

    @Override
    public List<TerminalSession> findOpenOnClosedTerminals() {
        return jdbcTemplate.query("""
            SELECT s.* FROM cash_register_sessions s
            JOIN terminals t ON t.id = s.terminal_id
            WHERE s.status = 'OPEN' AND t.status <> 'OPEN'
            ORDER BY s.opened_at
            """, ROW_MAPPER);
    }

    @Override
    public List<TerminalSession> findOpenedBefore(Instant cutoff) {
        return jdbcTemplate.query(
            "SELECT * FROM cash_register_sessions WHERE status = 'OPEN' AND opened_at < ? ORDER BY opened_at",
            ROW_MAPPER, Timestamp.from(cutoff));
    }

    private Optional<TerminalSession> first(String sql, Object... args) {
        return jdbcTemplate.query(sql, ROW_MAPPER, args).stream().findFirst();
    }
}
