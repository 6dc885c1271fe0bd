package com.bookati.common.event;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Topics {

    // Booking
    public static final String BOOKING_HELD = "bookati.booking.held";
    public static final String BOOKING_CONFIRMED = "bookati.booking.confirmed";
    public static final String BOOKING_CANCELLED = "bookati.booking.cancelled";
    public static final String BOOKING_RESCHEDULED = "bookati.booking.rescheduled";

    // Dead Letter Topics (DLT) - suffix: .DLT
    public static final String DLT_SUFFIX = ".DLT";

    public static final int PARTITIONS_BOOKING = 8;

    public static String dlt(String topic) {
        return topic + DLT_SUFFIX;
    }

    public static String forEventType(String eventType) {
        return switch (eventType) {
            case BookingEvent.TYPE_HELD -> BOOKING_HELD;
            case BookingEvent.TYPE_CONFIRMED -> BOOKING_CONFIRMED;
            case BookingEvent.TYPE_CANCELLED -> BOOKING_CANCELLED;
            case BookingEvent.TYPE_RESCHEDULED -> BOOKING_RESCHEDULED;
            default -> throw new IllegalArgumentException("No topic for event type " + eventType);
        };
    }
}
