package com.bookati.booking.event.producer;

import com.bookati.booking.domain.Booking;
import com.bookati.booking.event.outbox.OutboxEventService;
import com.bookati.common.event.BookingEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Booking events go through the outbox, so every call must run inside the
 * transaction that changed the booking.
 */
@Component
@RequiredArgsConstructor
public class BookingEventProducer {

    private static final String AGGREGATE_TYPE = "Booking";

    private final OutboxEventService outboxEventService;

    public void publishBookingHeld(Booking booking) {
        outboxEventService.save(AGGREGATE_TYPE, BookingEvent.held(
                booking.getTenantId(), booking.getId(), booking.getResourceId(),
                booking.getSlotStart(), booking.getTotalPrice()));
    }

    public void publishBookingConfirmed(Booking booking) {
        outboxEventService.save(AGGREGATE_TYPE, BookingEvent.confirmed(
                booking.getTenantId(), booking.getId(), booking.getResourceId(),
                booking.getSlotStart(), booking.getTotalPrice()));
    }

    public void publishBookingCancelled(Booking booking) {
        outboxEventService.save(AGGREGATE_TYPE, BookingEvent.cancelled(
                booking.getTenantId(), booking.getId(), booking.getResourceId(), booking.getSlotStart()));
    }

    public void publishBookingRescheduled(Booking booking) {
        outboxEventService.save(AGGREGATE_TYPE, BookingEvent.rescheduled(
                booking.getTenantId(), booking.getId(), booking.getResourceId(), booking.getSlotStart()));
    }
}
