package com.bookati.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Base of every event published through the outbox. {@code eventId} is the idempotency key
 * consumers record before acting.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class DomainEvent {

    private String eventId;
    private String eventType;
    private String tenantId;
    private Instant occurredAt;

    protected DomainEvent(String eventType, String tenantId) {
        this.eventId = UUID.randomUUID().toString();
        this.eventType = eventType;
        this.tenantId = tenantId;
        this.occurredAt = Instant.now();
    }

    /** Kafka record key; events sharing a key keep their relative order. */
    public abstract String partitionKey();
}
