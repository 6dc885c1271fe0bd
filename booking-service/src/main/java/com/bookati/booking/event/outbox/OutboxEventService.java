package com.bookati.booking.event.outbox;

import com.bookati.common.event.DomainEvent;
import com.bookati.common.event.Topics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Saves events to the outbox table within the caller's transaction, so an event exists
 * exactly when the state change that caused it was committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxEventService {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent save(String aggregateType, DomainEvent event) {
        String topic = Topics.forEventType(event.getEventType());

        OutboxEvent outboxEvent = OutboxEvent.builder()
                .aggregateType(aggregateType)
                .aggregateId(event.partitionKey())
                .tenantId(event.getTenantId())
                .eventType(event.getEventType())
                .topic(topic)
                .partitionKey(event.partitionKey())
                .payload(serialize(event))
                .build();

        outboxEventRepository.save(outboxEvent);
        log.debug("Outbox event saved: type={}, topic={}, aggregateId={}",
                event.getEventType(), topic, event.partitionKey());
        return outboxEvent;
    }

    private String serialize(DomainEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize outbox event: " + event.getEventType(), e);
        }
    }
}
