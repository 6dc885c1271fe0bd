package com.bookati.booking.event.consumer;

import com.bookati.booking.event.IdempotencyService;
import com.bookati.booking.ticket.StepResult;
import com.bookati.booking.ticket.TicketPipelineResult;
import com.bookati.booking.ticket.TicketPipelineService;
import com.bookati.booking.ticket.TicketReason;
import com.bookati.common.event.BookingEvent;
import com.bookati.common.event.Topics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TicketEventConsumerTest {

    private static final LocalDateTime SLOT = LocalDateTime.of(2025, 1, 1, 10, 0);

    @Mock
    private TicketPipelineService ticketPipelineService;
    @Mock
    private IdempotencyService idempotencyService;

    @InjectMocks
    private TicketEventConsumer consumer;

    @Test
    void handleBookingEvent_confirmed_runsPipelineAndMarksProcessed() {
        BookingEvent event = BookingEvent.confirmed("spa-cairo", 1L, "room-1", SLOT, new BigDecimal("700.00"));
        when(idempotencyService.isDuplicate(event)).thenReturn(false);
        when(ticketPipelineService.generateAndDeliver(1L, TicketReason.CONFIRMED)).thenReturn(succeeded(1L));

        consumer.handleBookingEvent(event, Topics.BOOKING_CONFIRMED);

        verify(ticketPipelineService).generateAndDeliver(1L, TicketReason.CONFIRMED);
        verify(idempotencyService).markProcessed(event, Topics.BOOKING_CONFIRMED);
    }

    @Test
    void handleBookingEvent_rescheduled_usesRescheduledReason() {
        BookingEvent event = BookingEvent.rescheduled("spa-cairo", 1L, "room-2", SLOT);
        when(idempotencyService.isDuplicate(event)).thenReturn(false);
        when(ticketPipelineService.generateAndDeliver(1L, TicketReason.RESCHEDULED)).thenReturn(succeeded(1L));

        consumer.handleBookingEvent(event, Topics.BOOKING_RESCHEDULED);

        verify(ticketPipelineService).generateAndDeliver(1L, TicketReason.RESCHEDULED);
    }

    @Test
    void handleBookingEvent_partialFailure_stillMarkedProcessed() {
        BookingEvent event = BookingEvent.confirmed("spa-cairo", 1L, "room-1", SLOT, new BigDecimal("700.00"));
        when(idempotencyService.isDuplicate(event)).thenReturn(false);
        TicketPipelineResult partial = new TicketPipelineResult(1L, StepResult.succeeded("42 bytes"),
                StepResult.failed("gateway returned 502"), StepResult.succeeded("mail-1"), 1, LocalDateTime.now());
        when(ticketPipelineService.generateAndDeliver(1L, TicketReason.CONFIRMED)).thenReturn(partial);

        consumer.handleBookingEvent(event, Topics.BOOKING_CONFIRMED);

        verify(idempotencyService).markProcessed(event, Topics.BOOKING_CONFIRMED);
    }

    @Test
    void handleBookingEvent_duplicate_skipsPipeline() {
        BookingEvent event = BookingEvent.confirmed("spa-cairo", 1L, "room-1", SLOT, new BigDecimal("700.00"));
        when(idempotencyService.isDuplicate(event)).thenReturn(true);

        consumer.handleBookingEvent(event, Topics.BOOKING_CONFIRMED);

        verifyNoInteractions(ticketPipelineService);
        verify(idempotencyService, never()).markProcessed(any(), any());
    }

    @Test
    void handleBookingEvent_pipelineThrows_notMarkedSoKafkaRetries() {
        BookingEvent event = BookingEvent.confirmed("spa-cairo", 1L, "room-1", SLOT, new BigDecimal("700.00"));
        when(idempotencyService.isDuplicate(event)).thenReturn(false);
        when(ticketPipelineService.generateAndDeliver(1L, TicketReason.CONFIRMED))
                .thenThrow(new IllegalStateException("database down"));

        assertThatThrownBy(() -> consumer.handleBookingEvent(event, Topics.BOOKING_CONFIRMED))
                .isInstanceOf(IllegalStateException.class);

        verify(idempotencyService, never()).markProcessed(any(), any());
    }

    private static TicketPipelineResult succeeded(Long bookingId) {
        return new TicketPipelineResult(bookingId, StepResult.succeeded("42 bytes"),
                StepResult.succeeded("wa-1"), StepResult.succeeded("mail-1"), 1, LocalDateTime.now());
    }
}
