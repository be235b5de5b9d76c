package com.flagship.pharmacy_pos.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for terminal session events.
 *
 * Events are keyed by terminal id, so three partitions still keep
 * every terminal's history in order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.terminal-sessions:pos.terminal-sessions}")
    private String terminalSessionsTopic;

    @Bean
    public NewTopic terminalSessionsTopic() {
        return TopicBuilder.name(terminalSessionsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
