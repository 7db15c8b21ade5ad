package com.flagship.class_enrollment.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event staged for publication to Kafka.
 *
 * Written in the same transaction as the enrollment it describes, then published
 * by {@link OutboxPublisher} once that transaction has committed. The aggregate id
 * doubles as the Kafka message key.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
