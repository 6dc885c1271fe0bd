package com.bookati.booking.ticket;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TicketDeliveryAttemptRepository extends JpaRepository<TicketDeliveryAttempt, Long> {

    List<TicketDeliveryAttempt> findByBookingIdOrderByIdAsc(Long bookingId);
}
