package com.flagship.pharmacy_pos.observability;

import com.flagship.pharmacy_pos.terminal.TerminalRepository;
import com.flagship.pharmacy_pos.terminal.TerminalSessionRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Refreshes the gauges that need a database query: outbox backlog and the
 * count of zombie terminals and orphan sessions.
 */
@Component
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final TerminalRepository terminalRepository;
    private final TerminalSessionRepository sessionRepository;
    private final AtomicInteger zombieTerminals = new AtomicInteger();
    private final AtomicInteger orphanSessions = new AtomicInteger();

    public MetricsScheduler(OutboxMetrics outboxMetrics, TerminalRepository terminalRepository,
                            TerminalSessionRepository sessionRepository, MeterRegistry meterRegistry) {
        this.outboxMetrics = outboxMetrics;
        this.terminalRepository = terminalRepository;
        this.sessionRepository = sessionRepository;

        Gauge.builder("pos.terminal.zombie", zombieTerminals, AtomicInteger::get)
                .description("Terminals marked OPEN with no open session")
                .register(meterRegistry);
        Gauge.builder("pos.session.orphan", orphanSessions, AtomicInteger::get)
                .description("Open sessions on terminals that are not OPEN")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        try {
            outboxMetrics.refreshMetrics();
            zombieTerminals.set(terminalRepository.findOpenWithoutSession().size());
            orphanSessions.set(sessionRepository.findOpenOnClosedTerminals().size());
        } catch (DataAccessException e) {
            log.warn("Gauge refresh failed, keeping previous values: {}", e.getMessage());
        }
    }

    int zombieTerminalCount() {
        return zombieTerminals.get();
    }

    int orphanSessionCount() {
        return orphanSessions.get();
    }
}
