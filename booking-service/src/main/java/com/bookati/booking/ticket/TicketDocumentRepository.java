package com.bookati.booking.ticket;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface TicketDocumentRepository extends JpaRepository<TicketDocument, Long> {

    Optional<TicketDocument> findByBookingId(Long bookingId);
}
