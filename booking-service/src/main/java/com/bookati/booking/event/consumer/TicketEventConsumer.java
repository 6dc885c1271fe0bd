package com.bookati.booking.event.consumer;

import com.bookati.booking.event.IdempotencyService;
import com.bookati.booking.ticket.TicketPipelineResult;
import com.bookati.booking.ticket.TicketPipelineService;
import com.bookati.booking.ticket.TicketReason;
import com.bookati.common.event.BookingEvent;
import com.bookati.common.event.Topics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

/**
 * Starts the ticket pipeline once a booking is confirmed or moved to another slot.
 * Runs on the listener thread, detached from the request that changed the booking.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TicketEventConsumer {

    private final TicketPipelineService ticketPipelineService;
    private final IdempotencyService idempotencyService;

    @KafkaListener(topics = {Topics.BOOKING_CONFIRMED, Topics.BOOKING_RESCHEDULED}, groupId = "ticket-pipeline")
    public void handleBookingEvent(BookingEvent event, @Header(KafkaHeaders.RECEIVED_TOPIC) String topic) {
        if (idempotencyService.isDuplicate(event)) {
            log.debug("Duplicate booking event skipped: eventId={}", event.getEventId());
            return;
        }

        TicketReason reason = BookingEvent.TYPE_RESCHEDULED.equals(event.getEventType())
                ? TicketReason.RESCHEDULED : TicketReason.CONFIRMED;
        log.info("Received {} event: bookingId={}, tenantId={}", event.getEventType(),
                event.getBookingId(), event.getTenantId());

        TicketPipelineResult result = ticketPipelineService.generateAndDeliver(event.getBookingId(), reason);
        if (result.partialFailure()) {
            log.warn("Ticket pipeline ended with failures: bookingId={}, pdf={}, whatsapp={}, email={}",
                    event.getBookingId(), result.pdf(), result.whatsapp(), result.email());
        }

        idempotencyService.markProcessed(event, topic);
    }
}
