package com.flagship.pharmacy_pos.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pharmacy_pos.terminal.event.SessionAutoClosedEvent;
import com.flagship.pharmacy_pos.terminal.event.SessionForceClosedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Kafka consumer for terminal session events.
 *
 * Offsets are acknowledged manually after the event has been handled; a
 * redelivered message is caught by {@link IdempotentEventProcessor}.
 * Unparseable messages are acknowledged and dropped so they cannot block
 * the partition.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SessionEventConsumer {

    static final String CONSUMER_GROUP = "session-notification-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final SessionEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.terminal-sessions:pos.terminal-sessions}",
        groupId = "${spring.kafka.consumer.group-id:pharmacy-pos-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEvent(record.value());
        if (envelope == null) {
            log.warn("Could not parse event, acknowledging to skip: offset={}", record.offset());
            ack.acknowledge();
            return;
        }

        try {
            boolean processed = routeEvent(envelope, record.value());
            ack.acknowledge();

            if (processed) {
                log.info("Processed event: type={}, eventId={}, terminalId={}",
                        envelope.eventType(), envelope.eventId(), envelope.terminalId());
            }
        } catch (RuntimeException e) {
            // not acknowledged: the container redelivers it
            log.error("Error processing event {} at offset {}: {}",
                    envelope.eventId(), record.offset(), e.getMessage(), e);
            throw e;
        }
    }

    private boolean routeEvent(EventEnvelope envelope, String rawPayload) {
        return switch (envelope.eventType()) {
            case SessionAutoClosedEvent.EVENT_TYPE -> eventProcessor.processEvent(envelope, CONSUMER_GROUP,
                () -> eventHandler.onSessionAutoClosed(deserialize(rawPayload, SessionAutoClosedEvent.class)));
            case SessionForceClosedEvent.EVENT_TYPE -> eventProcessor.processEvent(envelope, CONSUMER_GROUP,
                () -> eventHandler.onSessionForceClosed(deserialize(rawPayload, SessionForceClosedEvent.class)));
            default -> {
                eventProcessor.ignoreEvent(envelope, CONSUMER_GROUP, "No notification for " + envelope.eventType());
                yield false;
            }
        };
    }

    EventEnvelope parseEvent(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!node.hasNonNull("eventId") || !node.hasNonNull("terminalId") || !node.hasNonNull("eventType")) {
                return null;
            }
            return new EventEnvelope(
                UUID.fromString(node.get("eventId").asText()),
                UUID.fromString(node.get("terminalId").asText()),
                node.get("eventType").asText());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
