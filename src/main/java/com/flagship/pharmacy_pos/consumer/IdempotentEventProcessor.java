package com.flagship.pharmacy_pos.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Turns each session event into at most one notification per consumer group.
 *
 * The notification and the processed-event row commit together, so a crash
 * between them replays the event instead of losing or doubling it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event was already handled
     */
    @Transactional
    public boolean processEvent(EventEnvelope envelope, String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(envelope.eventId(), consumerGroup)) {
            log.info("Duplicate delivery of {} {} for group {}, dropping",
                    envelope.eventType(), envelope.eventId(), consumerGroup);
            return false;
        }

        handler.run();
        repository.save(ProcessedEventEntity.notified(envelope, consumerGroup));
        return true;
    }

    @Transactional
    public void ignoreEvent(EventEnvelope envelope, String consumerGroup, String reason) {
        if (isAlreadyProcessed(envelope.eventId(), consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.ignored(envelope, consumerGroup, reason));
        log.debug("Ignored {} {} on terminal {}: {}",
                envelope.eventType(), envelope.eventId(), envelope.terminalId(), reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
