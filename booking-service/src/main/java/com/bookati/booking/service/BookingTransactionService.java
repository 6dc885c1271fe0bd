package com.bookati.booking.service;

import com.bookati.booking.domain.Booking;
import com.bookati.booking.domain.BookingStatus;
import com.bookati.booking.domain.CustomerContact;
import com.bookati.booking.domain.SlotKey;
import com.bookati.booking.event.producer.BookingEventProducer;
import com.bookati.booking.exception.SlotUnavailableException;
import com.bookati.booking.jooq.SlotLedgerJooqRepository;
import com.bookati.booking.repository.BookingRepository;
import com.bookati.common.exception.BusinessException;
import com.bookati.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Separated from BookingService to ensure @Transactional works
 * (avoids Spring AOP self-invocation bypass).
 *
 * <p>Booking row, line items, slot-ledger row and outbox event are written in one
 * transaction: a booking is never visible without its slot, nor a slot without its booking.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingTransactionService {

    private final BookingRepository bookingRepository;
    private final SlotLedgerJooqRepository slotLedgerRepository;
    private final PackageComposer packageComposer;
    private final BookingEventProducer bookingEventProducer;

    /**
     * Tier 2: slot-ledger unique key inside the booking transaction.
     *
     * @param holdExpiresAt null for a direct (confirmed) booking, otherwise the end of the checkout hold
     */
    @Transactional
    public Booking createInTransaction(SlotKey slot, int durationMinutes, CustomerContact customer,
                                       PackageSelection selection, LocalDateTime holdExpiresAt) {
        freeExpiredHold(slot);

        List<ResolvedLineItem> lineItems = packageComposer.resolve(slot.tenantId(), selection);

        Booking booking = Booking.builder()
                .tenantId(slot.tenantId())
                .resourceId(slot.resourceId())
                .slotStart(slot.slotStart())
                .durationMinutes(durationMinutes)
                .customer(customer)
                .packageId(selection.packageId())
                .holdExpiresAt(holdExpiresAt)
                .build();
        for (ResolvedLineItem item : lineItems) {
            booking.addLineItem(item.serviceId(), item.serviceName(), item.quantity(), item.unitPrice());
        }

        booking = bookingRepository.saveAndFlush(booking);

        if (!slotLedgerRepository.insertIfFree(slot, durationMinutes, booking.getId())) {
            throw new SlotUnavailableException(slot);
        }

        if (booking.getStatus() == BookingStatus.CONFIRMED) {
            bookingEventProducer.publishBookingConfirmed(booking);
        } else {
            bookingEventProducer.publishBookingHeld(booking);
        }
        return booking;
    }

    @Transactional
    public Booking confirm(Long bookingId, String tenantId) {
        Booking booking = load(bookingId, tenantId);
        if (booking.getStatus() == BookingStatus.CONFIRMED) {
            return booking;
        }
        if (booking.isExpired()) {
            throw new BusinessException(ErrorCode.BOOKING_EXPIRED, "Booking hold has expired: " + bookingId);
        }

        booking.confirm();
        booking = bookingRepository.save(booking);
        bookingEventProducer.publishBookingConfirmed(booking);
        return booking;
    }

    @Transactional
    public Booking cancel(Long bookingId, String tenantId) {
        Booking booking = load(bookingId, tenantId);
        if (booking.getStatus() == BookingStatus.CANCELLED) {
            return booking;
        }
        return release(booking);
    }

    /**
     * Moves an active booking to another slot. The old ledger row is only gone once the new
     * one is in, since both happen in this transaction.
     */
    @Transactional
    public Booking reschedule(Long bookingId, String tenantId, SlotKey newSlot, int durationMinutes) {
        Booking booking = load(bookingId, tenantId);
        if (!booking.getStatus().isActive()) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_STATE,
                    "Cannot reschedule booking: current status=" + booking.getStatus());
        }

        boolean slotChanged = !booking.slotKey().equals(newSlot);
        if (slotChanged) {
            freeExpiredHold(newSlot);
            slotLedgerRepository.releaseByBooking(bookingId);
            if (!slotLedgerRepository.insertIfFree(newSlot, durationMinutes, bookingId)) {
                throw new SlotUnavailableException(newSlot);
            }
        } else if (booking.getDurationMinutes() != durationMinutes) {
            slotLedgerRepository.updateDuration(bookingId, durationMinutes);
        }

        booking.moveTo(newSlot.resourceId(), newSlot.slotStart(), durationMinutes);
        booking = bookingRepository.save(booking);

        if (slotChanged && booking.getStatus() == BookingStatus.CONFIRMED) {
            bookingEventProducer.publishBookingRescheduled(booking);
        }
        return booking;
    }

    /**
     * Cancels a pending booking whose hold ran out. Returns false when the booking was
     * confirmed, cancelled or extended in the meantime.
     */
    @Transactional
    public boolean releaseExpired(Long bookingId) {
        Booking booking = bookingRepository.findById(bookingId).orElse(null);
        if (booking == null || !booking.isExpired()) {
            return false;
        }
        release(booking);
        return true;
    }

    /**
     * An expired checkout hold does not own its slot: it is released here, in the caller's
     * transaction, before the slot is claimed. Any other holder makes the slot unavailable.
     */
    private void freeExpiredHold(SlotKey slot) {
        Optional<Long> holderId = slotLedgerRepository.findHolder(slot);
        if (holderId.isEmpty()) {
            return;
        }
        Booking holder = bookingRepository.findById(holderId.get()).orElse(null);
        if (holder == null || !holder.isExpired()) {
            throw new SlotUnavailableException(slot);
        }
        log.info("Expired hold gives up its slot: bookingId={}, slot={}", holder.getId(), slot);
        release(holder);
    }

    private Booking release(Booking booking) {
        slotLedgerRepository.releaseByBooking(booking.getId());
        booking.cancel();
        booking = bookingRepository.save(booking);
        bookingEventProducer.publishBookingCancelled(booking);
        log.info("Booking released: bookingId={}, slot={}", booking.getId(), booking.slotKey());
        return booking;
    }

    private Booking load(Long bookingId, String tenantId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                        "Booking not found: " + bookingId));
        if (!booking.belongsTo(tenantId)) {
            throw new BusinessException(ErrorCode.FORBIDDEN,
                    "Booking " + bookingId + " does not belong to tenant " + tenantId);
        }
        return booking;
    }
}
