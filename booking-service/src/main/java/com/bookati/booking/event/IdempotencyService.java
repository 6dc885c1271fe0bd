package com.bookati.booking.event;

import com.bookati.common.event.DomainEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Kafka consumer deduplication on the event id.
 * The primary key of processed_events settles concurrent redeliveries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private final ProcessedEventRepository processedEventRepository;

    /**
     * Returns true if the event was already processed and should be skipped.
     */
    public boolean isDuplicate(DomainEvent event) {
        if (event.getEventId() == null) {
            return false;
        }
        return processedEventRepository.existsById(event.getEventId());
    }

    public void markProcessed(DomainEvent event, String topic) {
        if (event.getEventId() == null) {
            return;
        }
        try {
            processedEventRepository.save(new ProcessedEvent(event.getEventId(), event.getEventType(), topic));
        } catch (DataIntegrityViolationException e) {
            log.debug("Duplicate event insert ignored: eventId={}", event.getEventId());
        }
    }
}
