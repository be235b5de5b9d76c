package com.flagship.pharmacy_pos.observability;

import com.flagship.pharmacy_pos.outbox.OutboxEventRepository;
import com.flagship.pharmacy_pos.terminal.TerminalRepository;
import com.flagship.pharmacy_pos.terminal.TerminalSessionRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Health indicators behind {@code /actuator/health}.
 *
 * Redis and Kafka being unavailable degrades the service but does not stop
 * terminals from opening and closing, so neither reports DOWN for that alone.
 */
public class HealthIndicators {

    /**
     * DOWN only when the backlog is large enough that notifications are hours late.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                long deadLettered = outboxRepository.countDeadLettered(maxRetries);

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("deadLettered", deadLettered)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only holds PIN attempt counters; the rate limiter falls back to memory.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            RedisConnectionFactory connectionFactory = template != null ? template.getConnectionFactory() : null;
            if (connectionFactory == null) {
                return degraded("Redis not configured");
            }

            try (RedisConnection connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                return "PONG".equals(result)
                        ? Health.up().withDetail("response", result).build()
                        : degraded("Unexpected ping response: " + result);
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private static Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "PIN attempt counters are kept in memory until Redis returns")
                    .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No Kafka connections established")
                            .withDetail("note", "Session events wait in the outbox")
                            .build();
                }
                return Health.up().withDetail("metricsCount", metrics.size()).build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Zombie terminals and orphan sessions. They need an administrator, not a
     * restart, so they are reported as WARNING rather than DOWN.
     */
    @Component("terminalIntegrityHealth")
    public static class TerminalIntegrityHealthIndicator implements HealthIndicator {

        private final TerminalRepository terminalRepository;
        private final TerminalSessionRepository sessionRepository;

        public TerminalIntegrityHealthIndicator(TerminalRepository terminalRepository,
                                                TerminalSessionRepository sessionRepository) {
            this.terminalRepository = terminalRepository;
            this.sessionRepository = sessionRepository;
        }

        @Override
        public Health health() {
            try {
                int zombies = terminalRepository.findOpenWithoutSession().size();
                int orphans = sessionRepository.findOpenOnClosedTerminals().size();

                Health.Builder builder = zombies == 0 && orphans == 0 ? Health.up() : Health.status("WARNING");
                return builder
                        .withDetail("zombieTerminals", zombies)
                        .withDetail("orphanSessions", orphans)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }
}
