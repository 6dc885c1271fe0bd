package com.bookati.booking.ticket;

public enum DeliveryAttemptStatus {
    SUCCESS,
    FAILED
}
