package com.bookati.booking.repository;

import com.bookati.booking.domain.Booking;
import com.bookati.booking.domain.BookingStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    List<Booking> findByStatusAndHoldExpiresAtBefore(
            BookingStatus status, LocalDateTime expiry, Pageable pageable);

    @Query("SELECT DISTINCT b FROM Booking b LEFT JOIN FETCH b.lineItems WHERE b.id = :id")
    Optional<Booking> findByIdWithLineItems(@Param("id") Long id);
}
