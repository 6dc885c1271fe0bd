package com.bookati.booking.ticket;

import com.bookati.booking.domain.Booking;
import com.bookati.booking.domain.BookingLineItem;
import com.bookati.booking.domain.BookingStatus;
import com.bookati.booking.domain.TicketLanguage;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Immutable copy of the booking data a ticket is rendered and delivered from.
 * Detached from the persistence context so pipeline steps can run on worker threads.
 */
public record TicketSnapshot(
        Long bookingId,
        String tenantId,
        String resourceId,
        LocalDateTime slotStart,
        int durationMinutes,
        String customerName,
        String customerEmail,
        String customerPhone,
        TicketLanguage language,
        BookingStatus status,
        BigDecimal totalPrice,
        List<Line> lines
) {

    public TicketSnapshot {
        lines = List.copyOf(lines);
    }

    public static TicketSnapshot from(Booking booking) {
        List<Line> lines = booking.getLineItems().stream()
                .map(Line::from)
                .toList();
        return new TicketSnapshot(
                booking.getId(),
                booking.getTenantId(),
                booking.getResourceId(),
                booking.getSlotStart(),
                booking.getDurationMinutes(),
                booking.getCustomer().getName(),
                booking.getCustomer().hasEmail() ? booking.getCustomer().getEmail() : null,
                booking.getCustomer().hasPhone() ? booking.getCustomer().getPhone() : null,
                booking.getCustomer().getLanguage(),
                booking.getStatus(),
                booking.getTotalPrice(),
                lines);
    }

    public LocalDateTime slotEnd() {
        return slotStart.plusMinutes(durationMinutes);
    }

    public record Line(Long serviceId, String serviceName, int quantity, BigDecimal unitPrice) {

        static Line from(BookingLineItem item) {
            return new Line(item.getServiceId(), item.getServiceName(), item.getQuantity(), item.getUnitPrice());
        }
    }
}
