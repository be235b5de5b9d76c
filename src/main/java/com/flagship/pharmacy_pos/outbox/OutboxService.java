package com.flagship.pharmacy_pos.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pharmacy_pos.terminal.event.SessionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Session events in and out of the outbox table.
 *
 * {@link #saveEvent} joins the engine's serializable transaction, so an event
 * exists exactly when the terminal change it describes committed. The
 * bookkeeping methods run in their own short transactions on behalf of
 * {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(SessionEvent event) {
        OutboxEventEntity saved = repository.save(OutboxEventEntity.pending(event, toJson(event)));
        log.debug("Queued {} for terminal {} (session {})",
                event.getEventType(), event.getTerminalId(), event.getSessionId());
        return saved.toEvent();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxAttempts) {
        return repository.findUnpublishedEventsForUpdate(limit, maxAttempts).stream()
                .map(OutboxEventEntity::toEvent)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        if (repository.markPublished(eventId, Instant.now()) == 0) {
            log.warn("Outbox event {} vanished before it could be marked published", eventId);
        }
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.recordFailure(eventId, errorMessage);
        log.warn("Publish of outbox event {} failed: {}", eventId, errorMessage);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForTerminal(UUID terminalId) {
        return repository.findByTerminalIdOrderBySequenceNumberAsc(terminalId).stream()
                .map(OutboxEventEntity::toEvent)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String toJson(SessionEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + event.getEventType(), e);
        }
    }
}
