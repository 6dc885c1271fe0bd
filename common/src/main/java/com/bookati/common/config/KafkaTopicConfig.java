package com.bookati.common.config;

import com.bookati.common.event.Topics;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;

/**
 * Auto-creates the booking lifecycle topics and their dead letter topics.
 * Only activates when spring.kafka.bootstrap-servers is configured.
 */
@AutoConfiguration
@ConditionalOnClass(KafkaAdmin.class)
@ConditionalOnProperty(name = "spring.kafka.bootstrap-servers")
public class KafkaTopicConfig {

    private static final short REPLICATION_FACTOR = 1;

    @Bean
    public KafkaAdmin.NewTopics bookingTopics() {
        return new KafkaAdmin.NewTopics(
                buildTopic(Topics.BOOKING_HELD),
                buildTopic(Topics.BOOKING_CONFIRMED),
                buildTopic(Topics.BOOKING_CANCELLED),
                buildTopic(Topics.BOOKING_RESCHEDULED));
    }

    // Only topics with consumers get a DLT
    @Bean
    public KafkaAdmin.NewTopics bookingDeadLetterTopics() {
        return new KafkaAdmin.NewTopics(
                buildTopic(Topics.dlt(Topics.BOOKING_CONFIRMED)),
                buildTopic(Topics.dlt(Topics.BOOKING_RESCHEDULED)));
    }

    private NewTopic buildTopic(String name) {
        return TopicBuilder.name(name)
                .partitions(Topics.PARTITIONS_BOOKING)
                .replicas(REPLICATION_FACTOR)
                .build();
    }
}
