package com.flagship.class_enrollment.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka configuration for enrollment events.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.enrollments:enrollments}")
    private String enrollmentsTopic;

    /**
     * Creates the enrollments topic if it doesn't exist.
     * Events are keyed by student, so 3 partitions keep per-student ordering.
     */
    @Bean
    public NewTopic enrollmentsTopic() {
        return TopicBuilder.name(enrollmentsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
