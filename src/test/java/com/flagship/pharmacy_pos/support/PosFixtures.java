package com.flagship.pharmacy_pos.support;

import com.flagship.pharmacy_pos.auth.Role;
import org.springframework.boot.test.context.TestComponent;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Inserts users, terminals and products straight into the tables, and reads
 * back the columns tests assert on.
 */
@TestComponent
public class PosFixtures {

    private final JdbcTemplate jdbcTemplate;
    private final PasswordEncoder pinEncoder;

    public PosFixtures(JdbcTemplate jdbcTemplate, PasswordEncoder pinEncoder) {
        this.jdbcTemplate = jdbcTemplate;
        this.pinEncoder = pinEncoder;
    }

    public UUID createUser(String name, Role role) {
        return insertUser(name, role, null, null);
    }

    public UUID createUserWithPin(String name, Role role, String pin) {
        return insertUser(name, role, pinEncoder.encode(pin), null);
    }

    public UUID createUserWithLegacyPin(String name, Role role, String pin) {
        return insertUser(name, role, null, pin);
    }

    private UUID insertUser(String name, Role role, String pinHash, String legacyPin) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO users (id, name, role, is_active, access_pin_hash, access_pin) VALUES (?, ?, ?, TRUE, ?, ?)",
            id, name, role.name(), pinHash, legacyPin);
        return id;
    }

    public void deactivateAllUsers() {
        jdbcTemplate.update("UPDATE users SET is_active = FALSE WHERE is_active");
    }

    public UUID createTerminal(String name) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO terminals (id, location_id, name, status) VALUES (?, ?, ?, 'CLOSED')",
            id, UUID.randomUUID(), name + "-" + id.toString().substring(0, 8));
        return id;
    }

    /**
     * Leaves a terminal OPEN for the user without any session, as a crash would.
     */
    public void makeZombie(UUID terminalId, UUID occupantId) {
        jdbcTemplate.update(
            "UPDATE terminals SET status = 'OPEN', current_cashier_id = ? WHERE id = ?", occupantId, terminalId);
    }

    public void markDeleted(UUID terminalId) {
        jdbcTemplate.update(
            "UPDATE terminals SET status = 'DELETED', current_cashier_id = NULL WHERE id = ?", terminalId);
    }

    /**
     * Releases the terminal while leaving its session OPEN.
     */
    public void makeOrphan(UUID terminalId) {
        jdbcTemplate.update(
            "UPDATE terminals SET status = 'CLOSED', current_cashier_id = NULL WHERE id = ?", terminalId);
    }

    public void backdateSession(UUID sessionId, Instant openedAt) {
        jdbcTemplate.update(
            "UPDATE cash_register_sessions SET opened_at = ? WHERE id = ?", Timestamp.from(openedAt), sessionId);
    }

    public UUID createProduct(BigDecimal price) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO products (id, sku, name, price, cost_price) VALUES (?, ?, ?, ?, ?)",
            id, "SKU-" + id.toString().substring(0, 8), "Paracetamol 500mg", price,
            price.multiply(new BigDecimal("0.60")));
        return id;
    }

    public UUID createBatch(UUID productId, BigDecimal unitPrice) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO inventory_batches (id, product_id, location_id, quantity, unit_price) VALUES (?, ?, ?, 10, ?)",
            id, productId, UUID.randomUUID(), unitPrice);
        return id;
    }

    public String terminalStatus(UUID terminalId) {
        return jdbcTemplate.queryForObject("SELECT status FROM terminals WHERE id = ?", String.class, terminalId);
    }

    public UUID terminalOccupant(UUID terminalId) {
        return jdbcTemplate.queryForObject(
            "SELECT current_cashier_id FROM terminals WHERE id = ?", UUID.class, terminalId);
    }

    public String sessionStatus(UUID sessionId) {
        return jdbcTemplate.queryForObject(
            "SELECT status FROM cash_register_sessions WHERE id = ?", String.class, sessionId);
    }

    public String sessionNotes(UUID sessionId) {
        return jdbcTemplate.queryForObject(
            "SELECT notes FROM cash_register_sessions WHERE id = ?", String.class, sessionId);
    }

    public BigDecimal sessionClosingAmount(UUID sessionId) {
        return jdbcTemplate.queryForObject(
            "SELECT closing_amount FROM cash_register_sessions WHERE id = ?", BigDecimal.class, sessionId);
    }

    public int openSessionCount(UUID terminalId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT count(*) FROM cash_register_sessions WHERE terminal_id = ? AND status = 'OPEN'",
            Integer.class, terminalId);
        return count == null ? 0 : count;
    }

    public int openSessionCountForUser(UUID userId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT count(*) FROM cash_register_sessions WHERE user_id = ? AND status = 'OPEN'",
            Integer.class, userId);
        return count == null ? 0 : count;
    }

    public List<String> movementTypes(UUID terminalId) {
        return jdbcTemplate.queryForList(
            "SELECT type FROM cash_movements WHERE terminal_id = ? ORDER BY created_at, type", String.class, terminalId);
    }

    public int auditCount(String actionCode, String entityId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT count(*) FROM audit_log WHERE action_code = ? AND entity_id = ?",
            Integer.class, actionCode, entityId);
        return count == null ? 0 : count;
    }

    public int outboxCount(UUID terminalId, String eventType) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT count(*) FROM outbox_events WHERE terminal_id = ? AND event_type = ?",
            Integer.class, terminalId, eventType);
        return count == null ? 0 : count;
    }

    public int remittanceCount(UUID terminalId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT count(*) FROM treasury_remittances WHERE source_terminal_id = ?", Integer.class, terminalId);
        return count == null ? 0 : count;
    }

    public BigDecimal productPrice(UUID productId) {
        return jdbcTemplate.queryForObject("SELECT price FROM products WHERE id = ?", BigDecimal.class, productId);
    }

    public BigDecimal batchUnitPrice(UUID batchId) {
        return jdbcTemplate.queryForObject(
            "SELECT unit_price FROM inventory_batches WHERE id = ?", BigDecimal.class, batchId);
    }

    public boolean isLockedPermanently(UUID userId) {
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(
            "SELECT locked_permanently FROM users WHERE id = ?", Boolean.class, userId));
    }

    public Instant lockedUntil(UUID userId) {
        Timestamp value = jdbcTemplate.queryForObject(
            "SELECT locked_until FROM users WHERE id = ?", Timestamp.class, userId);
        return value == null ? null : value.toInstant();
    }

    public int failureCount(UUID userId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT login_failure_count FROM users WHERE id = ?", Integer.class, userId);
        return count == null ? 0 : count;
    }
}
