package com.flagship.billing_eligibility.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in the outbox to be relayed to Kafka.
 *
 * Written in the same transaction as the snapshot it describes, so an
 * event exists if and only if its snapshot committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Snapshot"
    UUID aggregateId;          // snapshot ID
    String eventType;          // "SnapshotPublished"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until relayed
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database

    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType,
                                     String payload, Instant createdAt) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
                createdAt, null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean hasExhaustedRetries(int maxRetries) {
        return retryCount >= maxRetries;
    }
}
