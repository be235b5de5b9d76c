package com.flagship.pharmacy_pos.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pharmacy_pos.terminal.event.SessionClosedEvent;
import com.flagship.pharmacy_pos.support.PostgresIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox writes, publish bookkeeping and retry limits.
 */
class OutboxServiceTest extends PostgresIntegrationTest {

    private static final int MAX_ATTEMPTS = 3;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Session event is stored keyed by terminal with its type and JSON payload")
    void saveSessionEvent() throws Exception {
        printTestHeader("Save session event");
        UUID terminalId = UUID.randomUUID();
        UUID sessionId = UUID.randomUUID();
        SessionClosedEvent closed = SessionClosedEvent.of(
                terminalId, sessionId, UUID.randomUUID(), new BigDecimal("480.00"), new BigDecimal("200.00"));

        OutboxEvent saved = inTransaction(() -> outboxService.saveEvent(closed));
        printOutput("payload", saved.getPayload());

        assertEquals(closed.getEventId(), saved.getId());
        assertEquals(terminalId, saved.getTerminalId());
        assertEquals(sessionId, saved.getSessionId());
        assertEquals(SessionClosedEvent.EVENT_TYPE, saved.getEventType());
        assertFalse(saved.isPublished());

        JsonNode payload = objectMapper.readTree(saved.getPayload());
        assertEquals(closed.getEventId().toString(), payload.get("eventId").asText());
        assertEquals("SessionClosed", payload.get("eventType").asText());
        assertEquals(List.of(saved.getId()), outboxEventRepository.findByTerminalIdOrderBySequenceNumberAsc(terminalId)
                .stream().map(OutboxEventEntity::getId).toList());
        printSuccess("Event stored");
    }

    @Test
    @DisplayName("Saving outside a transaction is refused")
    void requiresTransaction() {
        SessionClosedEvent closed = SessionClosedEvent.of(
                UUID.randomUUID(), null, UUID.randomUUID(), BigDecimal.ONE, BigDecimal.ZERO);

        assertThrows(IllegalTransactionStateException.class, () -> outboxService.saveEvent(closed));
    }

    @Test
    @DisplayName("Event disappears when the surrounding transaction rolls back")
    void rolledBackWithCaller() {
        UUID terminalId = UUID.randomUUID();

        assertThrows(IllegalStateException.class, () -> inTransaction(() -> {
            outboxService.saveEvent(SessionClosedEvent.of(
                    terminalId, null, UUID.randomUUID(), BigDecimal.ONE, BigDecimal.ZERO));
            throw new IllegalStateException("business step failed");
        }));

        assertTrue(outboxService.getEventsForTerminal(terminalId).isEmpty());
    }

    @Test
    @DisplayName("Published events leave the backlog; failing ones stop at max attempts")
    void publishBookkeeping() {
        printTestHeader("Publish bookkeeping");
        UUID terminalId = UUID.randomUUID();
        OutboxEvent good = inTransaction(() -> outboxService.saveEvent(SessionClosedEvent.of(
                terminalId, null, UUID.randomUUID(), BigDecimal.ONE, BigDecimal.ZERO)));
        OutboxEvent bad = inTransaction(() -> outboxService.saveEvent(SessionClosedEvent.of(
                terminalId, null, UUID.randomUUID(), BigDecimal.TEN, BigDecimal.ZERO)));
        long deadBefore = outboxEventRepository.countDeadLettered(MAX_ATTEMPTS);

        outboxService.markPublished(good.getId());
        for (int i = 0; i < MAX_ATTEMPTS; i++) {
            outboxService.markFailed(bad.getId(), "broker unavailable");
        }

        List<OutboxEvent> pending = outboxService.findUnpublishedEvents(10_000, MAX_ATTEMPTS);
        assertTrue(pending.stream().noneMatch(e -> e.getId().equals(good.getId())));
        assertTrue(pending.stream().noneMatch(e -> e.getId().equals(bad.getId())));

        OutboxEvent failed = outboxService.getEventsForTerminal(terminalId).stream()
                .filter(e -> e.getId().equals(bad.getId())).findFirst().orElseThrow();
        printOutput("failed", failed);
        assertEquals(MAX_ATTEMPTS, failed.getAttempts());
        assertEquals("broker unavailable", failed.getLastError());
        assertEquals(deadBefore + 1, outboxEventRepository.countDeadLettered(MAX_ATTEMPTS));
        assertTrue(outboxService.countUnpublished() >= 1);
        printSuccess("Dead letter kept for manual attention");
    }

    private <T> T inTransaction(Supplier<T> action) {
        return new TransactionTemplate(transactionManager).execute(status -> action.get());
    }
}
