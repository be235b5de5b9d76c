package com.flagship.pharmacy_pos.observability;

import com.flagship.pharmacy_pos.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * How far session events lag behind the terminal changes that produced them.
 *
 * The gauges read the last {@link Backlog} snapshot taken by
 * {@link MetricsScheduler}; a scrape never touches the database.
 */
@Component
@Slf4j
public class OutboxMetrics {

    record Backlog(long pending, long oldestAgeSeconds, long deadLettered) {
        static final Backlog EMPTY = new Backlog(0, 0, 0);
    }

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final int maxAttempts;
    private final AtomicReference<Backlog> backlog = new AtomicReference<>(Backlog.EMPTY);

    public OutboxMetrics(OutboxEventRepository outboxRepository, MeterRegistry meterRegistry,
                         @Value("${outbox.publisher.max-retries:5}") int maxAttempts) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.maxAttempts = maxAttempts;

        Gauge.builder("pos.outbox.pending", backlog, ref -> ref.get().pending())
                .description("Session events not yet on Kafka")
                .register(meterRegistry);
        Gauge.builder("pos.outbox.oldest_pending.seconds", backlog, ref -> ref.get().oldestAgeSeconds())
                .description("Age of the oldest session event not yet on Kafka")
                .register(meterRegistry);
        Gauge.builder("pos.outbox.dead_lettered", backlog, ref -> ref.get().deadLettered())
                .description("Session events that ran out of publish attempts")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        long oldestAge = outboxRepository.findOldestUnpublishedCreatedAt()
                .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
                .orElse(0L);
        Backlog snapshot = new Backlog(
                outboxRepository.countUnpublished(),
                oldestAge,
                outboxRepository.countDeadLettered(maxAttempts));
        backlog.set(snapshot);
        log.debug("Outbox backlog: {}", snapshot);
    }

    Backlog currentBacklog() {
        return backlog.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("pos.outbox.published", "event_type", eventType, "result", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("pos.outbox.published", "event_type", eventType, "result", "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("pos.outbox.gave_up", "event_type", eventType).increment();
    }
}
