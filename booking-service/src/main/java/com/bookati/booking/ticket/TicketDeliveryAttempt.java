package com.bookati.booking.ticket;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Append-only audit row, one per executed pipeline step. Never updated or deleted.
 */
@Entity
@Table(name = "ticket_delivery_attempts",
        indexes = @Index(name = "idx_delivery_attempt_booking", columnList = "booking_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TicketDeliveryAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_id", nullable = false, updatable = false)
    private Long bookingId;

    @Column(nullable = false, length = 64, updatable = false)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private TicketChannel channel;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private DeliveryAttemptStatus status;

    @Column(length = 500, updatable = false)
    private String errorDetail;

    @Column(length = 200, updatable = false)
    private String providerReference;

    @Column(nullable = false, updatable = false)
    private long durationMs;

    @Column(nullable = false, updatable = false)
    private LocalDateTime attemptedAt;

    @Builder
    private TicketDeliveryAttempt(Long bookingId, String tenantId, TicketChannel channel,
                                  DeliveryAttemptStatus status, String errorDetail,
                                  String providerReference, long durationMs) {
        this.bookingId = bookingId;
        this.tenantId = tenantId;
        this.channel = channel;
        this.status = status;
        this.errorDetail = errorDetail != null && errorDetail.length() > 500
                ? errorDetail.substring(0, 500) : errorDetail;
        this.providerReference = providerReference;
        this.durationMs = durationMs;
        this.attemptedAt = LocalDateTime.now();
    }
}
