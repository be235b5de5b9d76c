package com.flagship.pharmacy_pos.observability;

import com.flagship.pharmacy_pos.exception.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized Micrometer meters for terminal sessions, authorization and audit.
 *
 * Metrics exposed:
 * - pos.session.opened / pos.session.closed (tag status)
 * - pos.session.idempotent_reopen: open requests answered with an existing session
 * - pos.session.auto_closed (tag reason)
 * - pos.operation.rejected (tags operation, kind)
 * - pos.operation.latency (tag operation)
 * - pos.audit.dropped (tag action): best-effort audit writes that failed
 * - pos.credentials.legacy_plaintext.used: PIN checks served by the legacy shim
 * - pos.authorization (tag result)
 */
@Component
public class PosMetrics {

    private final MeterRegistry registry;

    private final Counter sessionsOpened;
    private final Counter idempotentReopens;
    private final Counter legacyCredentialUse;

    public PosMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.sessionsOpened = Counter.builder("pos.session.opened")
                .description("Number of terminal sessions opened")
                .register(registry);

        this.idempotentReopens = Counter.builder("pos.session.idempotent_reopen")
                .description("Open requests answered with the already open session")
                .register(registry);

        this.legacyCredentialUse = Counter.builder("pos.credentials.legacy_plaintext.used")
                .description("PIN verifications that fell back to a legacy plaintext credential")
                .register(registry);
    }

    public void incrementSessionsOpened() {
        sessionsOpened.increment();
    }

    public void incrementIdempotentReopens() {
        idempotentReopens.increment();
    }

    public void incrementLegacyCredentialUse() {
        legacyCredentialUse.increment();
    }

    public void recordSessionClosed(String status) {
        registry.counter("pos.session.closed", "status", sanitizeTag(status)).increment();
    }

    public void recordSessionAutoClosed(String reason) {
        registry.counter("pos.session.auto_closed", "reason", sanitizeTag(reason)).increment();
    }

    public void recordRejected(String operation, ErrorKind kind) {
        registry.counter("pos.operation.rejected",
                "operation", sanitizeTag(operation),
                "kind", kind.name()
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        Timer.builder("pos.operation.latency")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordAuditDropped(String action) {
        registry.counter("pos.audit.dropped", "action", sanitizeTag(action)).increment();
    }

    public void recordAuthorization(String result) {
        registry.counter("pos.authorization", "result", sanitizeTag(result)).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
