package com.bookati.booking.domain;

import com.bookati.booking.exception.InvalidPackageException;
import com.bookati.common.domain.BaseTimeEntity;
import com.bookati.common.exception.BusinessException;
import com.bookati.common.response.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "bookings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Booking extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String tenantId;

    @Column(nullable = false, length = 64)
    private String resourceId;

    @Column(nullable = false)
    private LocalDateTime slotStart;

    @Column(nullable = false)
    private int durationMinutes;

    @Embedded
    private CustomerContact customer;

    private Long packageId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal totalPrice;

    private LocalDateTime holdExpiresAt;

    @Version
    private Long version;

    @OneToMany(mappedBy = "booking", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("serviceId ASC")
    private List<BookingLineItem> lineItems = new ArrayList<>();

    /**
     * A booking built with {@code holdExpiresAt} starts as a pending checkout hold,
     * otherwise it is confirmed on creation.
     */
    @Builder
    private Booking(String tenantId, String resourceId, LocalDateTime slotStart, int durationMinutes,
                    CustomerContact customer, Long packageId, LocalDateTime holdExpiresAt) {
        this.tenantId = tenantId;
        this.resourceId = resourceId;
        this.slotStart = slotStart;
        this.durationMinutes = durationMinutes;
        this.customer = customer;
        this.packageId = packageId;
        this.holdExpiresAt = holdExpiresAt;
        this.status = holdExpiresAt != null ? BookingStatus.PENDING : BookingStatus.CONFIRMED;
        this.totalPrice = BigDecimal.ZERO;
    }

    public void addLineItem(Long serviceId, String serviceName, int quantity, BigDecimal unitPrice) {
        if (quantity <= 0) {
            throw new InvalidPackageException("Quantity must be positive for service " + serviceId);
        }
        boolean duplicate = lineItems.stream().anyMatch(item -> item.getServiceId().equals(serviceId));
        if (duplicate) {
            throw new InvalidPackageException("Service " + serviceId + " appears twice in booking");
        }
        BookingLineItem item = new BookingLineItem(this, serviceId, serviceName, quantity, unitPrice);
        this.lineItems.add(item);
        this.totalPrice = this.totalPrice.add(item.lineTotal());
    }

    public SlotKey slotKey() {
        return new SlotKey(tenantId, resourceId, slotStart);
    }

    public boolean belongsTo(String tenantId) {
        return this.tenantId.equals(tenantId);
    }

    public void confirm() {
        if (this.status == BookingStatus.CONFIRMED) {
            return; // idempotent
        }
        if (this.status != BookingStatus.PENDING) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_STATE,
                    "Cannot confirm booking: current status=" + this.status);
        }
        this.status = BookingStatus.CONFIRMED;
        this.holdExpiresAt = null;
    }

    public void cancel() {
        if (this.status == BookingStatus.CANCELLED) {
            return; // idempotent
        }
        this.status = BookingStatus.CANCELLED;
        this.holdExpiresAt = null;
    }

    public void moveTo(String resourceId, LocalDateTime slotStart, int durationMinutes) {
        if (!this.status.isActive()) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_STATE,
                    "Cannot reschedule booking: current status=" + this.status);
        }
        this.resourceId = resourceId;
        this.slotStart = slotStart;
        this.durationMinutes = durationMinutes;
    }

    public boolean isExpired() {
        return this.status == BookingStatus.PENDING
                && this.holdExpiresAt != null
                && LocalDateTime.now().isAfter(this.holdExpiresAt);
    }
}
