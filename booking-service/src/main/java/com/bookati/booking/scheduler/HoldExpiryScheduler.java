package com.bookati.booking.scheduler;

import com.bookati.booking.config.BookingProperties;
import com.bookati.booking.domain.Booking;
import com.bookati.booking.domain.BookingStatus;
import com.bookati.booking.repository.BookingRepository;
import com.bookati.booking.service.BookingTransactionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Cancels checkout holds that were never confirmed and frees their slots.
 * Runs every 30 seconds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HoldExpiryScheduler {

    private final BookingRepository bookingRepository;
    private final BookingTransactionService transactionService;
    private final BookingProperties bookingProperties;

    @Scheduled(fixedRate = 30_000)
    @SchedulerLock(name = "holdExpiry", lockAtMostFor = "5m", lockAtLeastFor = "10s")
    public void releaseExpiredHolds() {
        List<Booking> expiredBookings = bookingRepository
                .findByStatusAndHoldExpiresAtBefore(
                        BookingStatus.PENDING, LocalDateTime.now(),
                        PageRequest.of(0, bookingProperties.getHoldExpiryBatchSize()));

        if (expiredBookings.isEmpty()) {
            return;
        }

        log.info("Releasing {} expired holds", expiredBookings.size());

        for (Booking booking : expiredBookings) {
            try {
                if (transactionService.releaseExpired(booking.getId())) {
                    log.info("Released expired hold: bookingId={}", booking.getId());
                }
            } catch (Exception e) {
                log.error("Failed to release expired hold: bookingId={}", booking.getId(), e);
            }
        }
    }
}
