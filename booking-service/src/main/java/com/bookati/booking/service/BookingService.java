package com.bookati.booking.service;

import com.bookati.booking.config.BookingProperties;
import com.bookati.booking.domain.Booking;
import com.bookati.booking.domain.CustomerContact;
import com.bookati.booking.domain.SlotKey;
import com.bookati.booking.domain.TicketLanguage;
import com.bookati.booking.exception.TransientStorageException;
import com.bookati.booking.repository.BookingRepository;
import com.bookati.booking.util.PhoneNumberNormalizer;
import com.bookati.common.exception.BusinessException;
import com.bookati.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.function.Supplier;

/**
 * Booking Locker. Every write that takes a slot runs as:
 * 1. Redis distributed lock on the slot key (cross-pod, bounded wait)
 * 2. Slot-ledger unique key inside the booking transaction
 * 3. Optimistic lock (@Version) on later status changes
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private final BookingRepository bookingRepository;
    private final BookingTransactionService transactionService;
    private final BookingLockService lockService;
    private final BookingProperties bookingProperties;

    /**
     * Direct booking: confirmed on success. Exactly one of several concurrent requests for the
     * same slot wins; the others get {@code SlotUnavailableException}.
     */
    public Booking createBooking(String tenantId, SlotRequest slotRequest, CustomerDetails customer,
                                 PackageSelection selection) {
        Booking booking = create(tenantId, slotRequest, customer, selection, null);
        log.info("Booking created: bookingId={}, slot={}, total={}",
                booking.getId(), booking.slotKey(), booking.getTotalPrice());
        return booking;
    }

    /**
     * Checkout hold: pending until confirmed, released by the hold-expiry scheduler otherwise.
     */
    public Booking holdSlot(String tenantId, SlotRequest slotRequest, CustomerDetails customer,
                            PackageSelection selection) {
        LocalDateTime holdExpiresAt = LocalDateTime.now().plus(bookingProperties.getHoldTtl());
        Booking booking = create(tenantId, slotRequest, customer, selection, holdExpiresAt);
        log.info("Slot held: bookingId={}, slot={}, expiresAt={}", booking.getId(), booking.slotKey(), holdExpiresAt);
        return booking;
    }

    public Booking confirmBooking(Long bookingId, String tenantId) {
        Booking booking = translateTransient(() -> transactionService.confirm(bookingId, tenantId));
        log.info("Booking confirmed: bookingId={}", bookingId);
        return booking;
    }

    public Booking cancelBooking(Long bookingId, String tenantId) {
        Booking booking = translateTransient(() -> transactionService.cancel(bookingId, tenantId));
        log.info("Booking cancelled: bookingId={}", bookingId);
        return booking;
    }

    public Booking rescheduleBooking(Long bookingId, String tenantId, SlotRequest newSlot) {
        validateSlot(newSlot);
        SlotKey slot = newSlot.toKey(tenantId);
        try (LockHandle lock = lockService.acquireSlotLock(slot)) {
            warnIfUnguarded(lock, slot);
            Booking booking = translateTransient(() ->
                    transactionService.reschedule(bookingId, tenantId, slot, newSlot.durationMinutes()));
            log.info("Booking rescheduled: bookingId={}, slot={}", bookingId, slot);
            return booking;
        }
    }

    @Transactional(readOnly = true)
    public Booking getBooking(Long bookingId, String tenantId) {
        Booking booking = bookingRepository.findByIdWithLineItems(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                        "Booking not found: " + bookingId));
        if (!booking.belongsTo(tenantId)) {
            throw new BusinessException(ErrorCode.FORBIDDEN,
                    "Booking " + bookingId + " does not belong to tenant " + tenantId);
        }
        return booking;
    }

    private Booking create(String tenantId, SlotRequest slotRequest, CustomerDetails customer,
                           PackageSelection selection, LocalDateTime holdExpiresAt) {
        validateSlot(slotRequest);
        CustomerContact contact = toContact(customer);
        SlotKey slot = slotRequest.toKey(tenantId);

        try (LockHandle lock = lockService.acquireSlotLock(slot)) {
            warnIfUnguarded(lock, slot);
            return translateTransient(() -> transactionService.createInTransaction(
                    slot, slotRequest.durationMinutes(), contact, selection, holdExpiresAt));
        }
    }

    private void warnIfUnguarded(LockHandle lock, SlotKey slot) {
        if (!lock.isGuarded()) {
            log.warn("Slot lock unavailable, ledger constraint is the only guard: slot={}", slot);
        }
    }

    private Booking translateTransient(Supplier<Booking> write) {
        try {
            return write.get();
        } catch (TransientDataAccessException | DataAccessResourceFailureException
                 | RecoverableDataAccessException | CannotCreateTransactionException e) {
            log.warn("Transient storage failure, nothing committed: {}", e.toString());
            throw new TransientStorageException("Storage temporarily unavailable, retry the request", e);
        }
    }

    private void validateSlot(SlotRequest slotRequest) {
        if (slotRequest.resourceId() == null || slotRequest.resourceId().isBlank()
                || slotRequest.start() == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Resource and start time are required");
        }
        if (slotRequest.durationMinutes() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Duration must be positive: " + slotRequest.durationMinutes());
        }
    }

    static CustomerContact toContact(CustomerDetails customer) {
        if (customer == null || customer.name() == null || customer.name().isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer name is required");
        }
        String phone = null;
        if (customer.phone() != null && !customer.phone().isBlank()) {
            phone = PhoneNumberNormalizer.normalize(customer.phone())
                    .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_INPUT,
                            "Invalid phone number: " + customer.phone()));
        }
        String email = customer.email() == null || customer.email().isBlank() ? null : customer.email().trim();
        return new CustomerContact(customer.name().trim(), email, phone, TicketLanguage.from(customer.language()));
    }
}
