package com.flagship.pharmacy_pos.outbox;

import com.flagship.pharmacy_pos.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ships pending session events to Kafka, keyed by terminal id.
 *
 * Once a send for a terminal fails, that terminal's later events in the same
 * batch are held back so the topic never sees them out of order. An event
 * that has failed {@code max-retries} times stays in the table as a dead
 * letter.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.terminal-sessions:pos.terminal-sessions}")
    private String terminalSessionsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.findUnpublishedEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Could not read the outbox, will retry on the next poll", e);
            return;
        }
        if (batch.isEmpty()) {
            return;
        }

        Set<UUID> blockedTerminals = new HashSet<>();
        int published = 0;
        for (OutboxEvent event : batch) {
            if (blockedTerminals.contains(event.getTerminalId())) {
                continue;
            }
            if (send(event)) {
                published++;
            } else {
                blockedTerminals.add(event.getTerminalId());
            }
        }
        log.debug("Outbox poll: {} of {} events published, {} terminals held back",
                published, batch.size(), blockedTerminals.size());
    }

    private boolean send(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(terminalSessionsTopic, event.getTerminalId().toString(), event.getPayload())
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            log.debug("Published {} {} to partition {} offset {}", event.getEventType(), event.getId(),
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted while publishing");
        } catch (ExecutionException | TimeoutException e) {
            String reason = e.getCause() != null ? e.getCause().getMessage() : e.getClass().getSimpleName();
            recordFailure(event, reason);
        } catch (RuntimeException e) {
            recordFailure(event, e.getMessage());
        }
        return false;
    }

    private void recordFailure(OutboxEvent event, String reason) {
        log.error("Failed to publish {} {} for terminal {}: {}",
                event.getEventType(), event.getId(), event.getTerminalId(), reason);
        outboxService.markFailed(event.getId(), reason);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        if (event.getAttempts() + 1 >= maxRetries) {
            log.warn("Outbox event {} gave up after {} attempts and needs manual attention",
                    event.getId(), maxRetries);
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
