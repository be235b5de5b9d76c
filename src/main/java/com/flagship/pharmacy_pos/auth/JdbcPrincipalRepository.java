package com.flagship.pharmacy_pos.auth;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Repository
public class JdbcPrincipalRepository implements PrincipalRepository {

    private static final String SELECT_COLUMNS = """
        SELECT id, name, role, is_active, access_pin_hash, access_pin,
               login_failure_count, locked_until, locked_permanently
        FROM users
        """;

    private static final RowMapper<Principal> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp lockedUntil = rs.getTimestamp("locked_until");
        return Principal.builder()
            .id(rs.getObject("id", UUID.class))
            .name(rs.getString("name"))
            .role(Role.parse(rs.getString("role")))
            .active(rs.getBoolean("is_active"))
            .credential(StoredCredential.resolve(
                rs.getString("access_pin_hash"), rs.getString("access_pin")).orElse(null))
            .failureCount(rs.getInt("login_failure_count"))
            .lockedUntil(lockedUntil != null ? lockedUntil.toInstant() : null)
            .lockedPermanently(rs.getBoolean("locked_permanently"))
            .build();
    };

    private final JdbcTemplate jdbcTemplate;

    public JdbcPrincipalRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Principal> findById(UUID id) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", ROW_MAPPER, id)
            .stream()
            .findFirst();
    }

    @Override
    public List<Principal> findActiveByRoles(Set<Role> roles) {
        if (roles.isEmpty()) {
            return List.of();
        }
        String[] codes = roles.stream().map(Role::name).toArray(String[]::new);
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE is_active = TRUE AND role = ANY (?) ORDER BY name, id",
            ps -> ps.setArray(1, ps.getConnection().createArrayOf("varchar", codes)),
            ROW_MAPPER);
    }

    @Override
    public int updateSecurityState(UUID id, PrincipalSecurityUpdate update) {
        if (update.isEmpty()) {
            return 0;
        }

        List<String> assignments = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        update.getFailureCount().ifPresent(count -> {
            assignments.add("login_failure_count = ?");
            params.add(count);
        });
        if (update.isClearLock()) {
            assignments.add("locked_until = NULL");
            assignments.add("locked_permanently = FALSE");
        } else {
            update.getLockedUntil().ifPresent(until -> {
                assignments.add("locked_until = ?");
                params.add(Timestamp.from(until));
            });
            update.getLockedPermanently().ifPresent(permanent -> {
                assignments.add("locked_permanently = ?");
                params.add(permanent);
            });
        }
        params.add(id);

        return jdbcTemplate.update(
            "UPDATE users SET " + String.join(", ", assignments) + " WHERE id = ?",
            params.toArray());
    }
}
