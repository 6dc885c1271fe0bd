package com.bookati.common.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEvent extends DomainEvent {

    public static final String TYPE_HELD = "BOOKING_HELD";
    public static final String TYPE_CONFIRMED = "BOOKING_CONFIRMED";
    public static final String TYPE_CANCELLED = "BOOKING_CANCELLED";
    public static final String TYPE_RESCHEDULED = "BOOKING_RESCHEDULED";

    private Long bookingId;
    private String resourceId;
    private LocalDateTime slotStart;
    private BigDecimal totalPrice;

    private BookingEvent(String eventType, String tenantId, Long bookingId,
                         String resourceId, LocalDateTime slotStart, BigDecimal totalPrice) {
        super(eventType, tenantId);
        this.bookingId = bookingId;
        this.resourceId = resourceId;
        this.slotStart = slotStart;
        this.totalPrice = totalPrice;
    }

    public static BookingEvent held(String tenantId, Long bookingId, String resourceId,
                                    LocalDateTime slotStart, BigDecimal totalPrice) {
        return new BookingEvent(TYPE_HELD, tenantId, bookingId, resourceId, slotStart, totalPrice);
    }

    public static BookingEvent confirmed(String tenantId, Long bookingId, String resourceId,
                                         LocalDateTime slotStart, BigDecimal totalPrice) {
        return new BookingEvent(TYPE_CONFIRMED, tenantId, bookingId, resourceId, slotStart, totalPrice);
    }

    public static BookingEvent cancelled(String tenantId, Long bookingId, String resourceId,
                                         LocalDateTime slotStart) {
        return new BookingEvent(TYPE_CANCELLED, tenantId, bookingId, resourceId, slotStart, null);
    }

    public static BookingEvent rescheduled(String tenantId, Long bookingId, String resourceId,
                                           LocalDateTime slotStart) {
        return new BookingEvent(TYPE_RESCHEDULED, tenantId, bookingId, resourceId, slotStart, null);
    }

    @Override
    @JsonIgnore
    public String partitionKey() {
        return String.valueOf(bookingId);
    }
}
