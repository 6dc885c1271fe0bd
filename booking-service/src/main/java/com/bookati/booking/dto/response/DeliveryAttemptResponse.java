package com.bookati.booking.dto.response;

import com.bookati.booking.ticket.DeliveryAttemptStatus;
import com.bookati.booking.ticket.TicketChannel;
import com.bookati.booking.ticket.TicketDeliveryAttempt;

import java.time.LocalDateTime;

public record DeliveryAttemptResponse(
        Long attemptId,
        TicketChannel channel,
        DeliveryAttemptStatus status,
        String errorDetail,
        String providerReference,
        long durationMs,
        LocalDateTime attemptedAt
) {
    public static DeliveryAttemptResponse from(TicketDeliveryAttempt attempt) {
        return new DeliveryAttemptResponse(
                attempt.getId(),
                attempt.getChannel(),
                attempt.getStatus(),
                attempt.getErrorDetail(),
                attempt.getProviderReference(),
                attempt.getDurationMs(),
                attempt.getAttemptedAt()
        );
    }
}
