package com.bookati.booking.dto.response;

import com.bookati.booking.domain.Booking;
import com.bookati.booking.domain.BookingStatus;
import com.bookati.booking.domain.TicketLanguage;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record BookingResponse(
        Long bookingId,
        String tenantId,
        String resourceId,
        LocalDateTime slotStart,
        int durationMinutes,
        BookingStatus status,
        Customer customer,
        Long packageId,
        BigDecimal totalPrice,
        LocalDateTime holdExpiresAt,
        List<LineItem> lineItems,
        LocalDateTime createdAt
) {
    public record Customer(String name, String email, String phone, TicketLanguage language) {
    }

    public record LineItem(Long serviceId, String serviceName, int quantity, BigDecimal unitPrice) {
    }

    public static BookingResponse from(Booking booking) {
        List<LineItem> lineItems = booking.getLineItems().stream()
                .map(item -> new LineItem(item.getServiceId(), item.getServiceName(),
                        item.getQuantity(), item.getUnitPrice()))
                .toList();
        var contact = booking.getCustomer();
        return new BookingResponse(
                booking.getId(),
                booking.getTenantId(),
                booking.getResourceId(),
                booking.getSlotStart(),
                booking.getDurationMinutes(),
                booking.getStatus(),
                new Customer(contact.getName(), contact.getEmail(), contact.getPhone(), contact.getLanguage()),
                booking.getPackageId(),
                booking.getTotalPrice(),
                booking.getHoldExpiresAt(),
                lineItems,
                booking.getCreatedAt()
        );
    }
}
