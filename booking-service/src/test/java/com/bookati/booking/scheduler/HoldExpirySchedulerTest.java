package com.bookati.booking.scheduler;

import com.bookati.booking.TestFixtures;
import com.bookati.booking.config.BookingProperties;
import com.bookati.booking.domain.BookingStatus;
import com.bookati.booking.repository.BookingRepository;
import com.bookati.booking.service.BookingTransactionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HoldExpirySchedulerTest {

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private BookingTransactionService transactionService;

    private HoldExpiryScheduler scheduler;

    @BeforeEach
    void setUp() {
        BookingProperties properties = new BookingProperties();
        properties.setHoldExpiryBatchSize(25);
        scheduler = new HoldExpiryScheduler(bookingRepository, transactionService, properties);
    }

    @Test
    void releaseExpiredHolds_noExpiredBookings_doesNothing() {
        when(bookingRepository.findByStatusAndHoldExpiresAtBefore(
                eq(BookingStatus.PENDING), any(LocalDateTime.class), eq(PageRequest.of(0, 25))))
                .thenReturn(Collections.emptyList());

        scheduler.releaseExpiredHolds();

        verifyNoInteractions(transactionService);
    }

    @Test
    void releaseExpiredHolds_oneFailsOtherContinues() {
        LocalDateTime expired = LocalDateTime.now().minusMinutes(1);
        when(bookingRepository.findByStatusAndHoldExpiresAtBefore(
                eq(BookingStatus.PENDING), any(LocalDateTime.class), any(PageRequest.class)))
                .thenReturn(List.of(TestFixtures.pendingBooking(1L, expired), TestFixtures.pendingBooking(2L, expired)));
        when(transactionService.releaseExpired(1L)).thenThrow(new RuntimeException("DB error"));
        when(transactionService.releaseExpired(2L)).thenReturn(true);

        scheduler.releaseExpiredHolds();

        verify(transactionService).releaseExpired(1L);
        verify(transactionService).releaseExpired(2L);
    }
}
