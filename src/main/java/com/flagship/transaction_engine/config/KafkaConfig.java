package com.flagship.transaction_engine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics backing the instruction queue.
 *
 * - {@code queue.topic}: instructions, keyed by source account
 * - {@code queue.dead-letter-topic}: poison instructions set aside for operators
 */
@Configuration
@ConditionalOnProperty(name = "queue.topics.auto-create", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${queue.topic:transactions}")
    private String instructionsTopic;

    @Value("${queue.dead-letter-topic:transactions.dlt}")
    private String deadLetterTopic;

    @Value("${queue.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic instructionsTopic() {
        return TopicBuilder.name(instructionsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic deadLetterTopic() {
        return TopicBuilder.name(deadLetterTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
