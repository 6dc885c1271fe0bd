package com.bookati.booking.event.outbox;

import com.bookati.common.event.BookingEvent;
import com.bookati.common.event.Topics;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OutboxEventServiceTest {

    @Mock
    private OutboxEventRepository outboxEventRepository;

    @Spy
    private ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @InjectMocks
    private OutboxEventService outboxEventService;

    @Test
    void save_persistsOutboxEventWithSerializedPayload() {
        BookingEvent event = BookingEvent.confirmed(
                "spa-cairo", 12L, "room-1", LocalDateTime.of(2025, 1, 1, 10, 0), new BigDecimal("700.00"));

        outboxEventService.save("Booking", event);

        ArgumentCaptor<OutboxEvent> captor = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxEventRepository).save(captor.capture());

        OutboxEvent saved = captor.getValue();
        assertThat(saved.getAggregateType()).isEqualTo("Booking");
        assertThat(saved.getAggregateId()).isEqualTo("12");
        assertThat(saved.getTenantId()).isEqualTo("spa-cairo");
        assertThat(saved.getEventType()).isEqualTo(BookingEvent.TYPE_CONFIRMED);
        assertThat(saved.getTopic()).isEqualTo(Topics.BOOKING_CONFIRMED);
        assertThat(saved.getPartitionKey()).isEqualTo("12");
        assertThat(saved.getPayload())
                .contains("\"bookingId\":12")
                .contains(event.getEventId())
                .doesNotContain("partitionKey");
        assertThat(saved.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.PENDING);
    }

    @Test
    void save_rescheduledEvent_routedToRescheduledTopic() {
        BookingEvent event = BookingEvent.rescheduled("spa-cairo", 12L, "room-2", LocalDateTime.of(2025, 1, 2, 9, 0));

        OutboxEvent saved = outboxEventService.save("Booking", event);

        assertThat(saved.getTopic()).isEqualTo(Topics.BOOKING_RESCHEDULED);
    }
}
