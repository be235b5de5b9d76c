package com.flagship.pharmacy_pos.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Endpoint polled by the till front end before it offers the open-terminal
 * screen. Answers 503 when the database does not.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record HealthStatus(String status,
                 @JsonProperty("open_terminals") Integer openTerminals,
                 @JsonProperty("checked_at") Instant checkedAt) {
    }

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        try {
            Integer open = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM terminals WHERE status = 'OPEN'", Integer.class);
            return ResponseEntity.ok(new HealthStatus("UP", open, Instant.now()));
        } catch (DataAccessException e) {
            log.warn("Database did not answer the health check: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new HealthStatus("DOWN", null, Instant.now()));
        }
    }
}
