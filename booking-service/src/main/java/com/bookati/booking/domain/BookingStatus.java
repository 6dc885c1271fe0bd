package com.bookati.booking.domain;

public enum BookingStatus {
    PENDING,
    CONFIRMED,
    CANCELLED;

    /** Active bookings own their slot in the ledger. */
    public boolean isActive() {
        return this != CANCELLED;
    }
}
