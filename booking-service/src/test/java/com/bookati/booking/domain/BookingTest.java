package com.bookati.booking.domain;

import com.bookati.booking.TestFixtures;
import com.bookati.booking.exception.InvalidPackageException;
import com.bookati.common.exception.BusinessException;
import com.bookati.common.response.ErrorCode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BookingTest {

    @Test
    void builder_withoutHold_createsConfirmedBooking() {
        Booking booking = TestFixtures.confirmedBooking(1L);

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(booking.getHoldExpiresAt()).isNull();
    }

    @Test
    void builder_withHold_createsPendingBooking() {
        Booking booking = TestFixtures.pendingBooking(1L, LocalDateTime.now().plusMinutes(2));

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
        assertThat(booking.isExpired()).isFalse();
    }

    @Test
    void addLineItem_accumulatesTotal() {
        Booking booking = TestFixtures.confirmedBooking(1L);

        assertThat(booking.getLineItems()).hasSize(2);
        assertThat(booking.getTotalPrice()).isEqualByComparingTo("700.00");

        booking.addLineItem(3L, "Facial", 2, new BigDecimal("150.00"));
        assertThat(booking.getTotalPrice()).isEqualByComparingTo("1000.00");
    }

    @Test
    void addLineItem_duplicateService_throws() {
        Booking booking = TestFixtures.confirmedBooking(1L);

        assertThatThrownBy(() -> booking.addLineItem(1L, "Massage", 1, BigDecimal.TEN))
                .isInstanceOf(InvalidPackageException.class)
                .hasMessageContaining("appears twice");
        assertThat(booking.getLineItems()).hasSize(2);
    }

    @Test
    void addLineItem_nonPositiveQuantity_throws() {
        Booking booking = TestFixtures.confirmedBooking(1L);

        assertThatThrownBy(() -> booking.addLineItem(3L, "Facial", 0, BigDecimal.TEN))
                .isInstanceOf(InvalidPackageException.class);
    }

    @Test
    void confirm_pendingBooking_clearsHold() {
        Booking booking = TestFixtures.pendingBooking(1L, LocalDateTime.now().plusMinutes(2));

        booking.confirm();

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(booking.getHoldExpiresAt()).isNull();
    }

    @Test
    void confirm_cancelledBooking_throws() {
        Booking booking = TestFixtures.confirmedBooking(1L);
        booking.cancel();

        assertThatThrownBy(booking::confirm)
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_BOOKING_STATE);
    }

    @Test
    void cancel_isIdempotent() {
        Booking booking = TestFixtures.confirmedBooking(1L);

        booking.cancel();
        booking.cancel();

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CANCELLED);
    }

    @Test
    void moveTo_cancelledBooking_throws() {
        Booking booking = TestFixtures.confirmedBooking(1L);
        booking.cancel();

        assertThatThrownBy(() -> booking.moveTo("room-2", TestFixtures.SLOT_START, 30))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    void isExpired_pastHold_true() {
        Booking booking = TestFixtures.pendingBooking(1L, LocalDateTime.now().minusSeconds(1));

        assertThat(booking.isExpired()).isTrue();
    }

    @Test
    void slotKey_truncatesToMinute() {
        SlotKey key = new SlotKey("t", "r", LocalDateTime.of(2025, 1, 1, 10, 0, 42));

        assertThat(key).isEqualTo(new SlotKey("t", "r", LocalDateTime.of(2025, 1, 1, 10, 0)));
        assertThat(key.lockName()).isEqualTo("lock:slot:t:r:20250101T1000");
    }

    @Test
    void ticketLanguage_unknownTagFallsBackToEnglish() {
        assertThat(TicketLanguage.from("ar")).isEqualTo(TicketLanguage.AR);
        assertThat(TicketLanguage.from("AR-eg")).isEqualTo(TicketLanguage.AR);
        assertThat(TicketLanguage.from("fr")).isEqualTo(TicketLanguage.EN);
        assertThat(TicketLanguage.from(null)).isEqualTo(TicketLanguage.EN);
    }
}
