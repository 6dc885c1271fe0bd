package com.bookati.booking.event.outbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxPollingPublisherTest {

    @Mock
    private OutboxEventRepository outboxEventRepository;
    @Mock
    private OutboxEventPublisher outboxEventPublisher;

    @InjectMocks
    private OutboxPollingPublisher pollingPublisher;

    @Test
    void pollAndPublish_noPendingEvents_doesNothing() {
        when(outboxEventRepository.findPendingEvents(anyInt())).thenReturn(Collections.emptyList());

        pollingPublisher.pollAndPublish();

        verifyNoInteractions(outboxEventPublisher);
    }

    @Test
    void pollAndPublish_failedEvent_holdsBackLaterEventsOfSameBooking() {
        OutboxEvent confirmed = event("1", "BOOKING_CONFIRMED");
        OutboxEvent rescheduled = event("1", "BOOKING_RESCHEDULED");
        OutboxEvent otherBooking = event("2", "BOOKING_CONFIRMED");
        when(outboxEventRepository.findPendingEvents(anyInt())).thenReturn(List.of(confirmed, rescheduled, otherBooking));
        when(outboxEventPublisher.publishEvent(confirmed)).thenReturn(false);
        when(outboxEventPublisher.publishEvent(otherBooking)).thenReturn(true);

        pollingPublisher.pollAndPublish();

        verify(outboxEventPublisher).publishEvent(confirmed);
        verify(outboxEventPublisher, never()).publishEvent(rescheduled);
        verify(outboxEventPublisher).publishEvent(otherBooking);
    }

    @Test
    void cleanupPublishedEvents_deletesOlderThanRetention() {
        when(outboxEventRepository.deletePublishedBefore(any(LocalDateTime.class))).thenReturn(3);

        pollingPublisher.cleanupPublishedEvents();

        verify(outboxEventRepository).deletePublishedBefore(any(LocalDateTime.class));
    }

    private static OutboxEvent event(String bookingId, String eventType) {
        return OutboxEvent.builder()
                .aggregateType("Booking")
                .aggregateId(bookingId)
                .tenantId("spa-cairo")
                .eventType(eventType)
                .topic("bookati.booking.confirmed")
                .partitionKey(bookingId)
                .payload("{}")
                .build();
    }
}
