package com.bookati.booking.ticket;

/** Why a ticket is being sent; selects the message wording. */
public enum TicketReason {
    CONFIRMED,
    RESCHEDULED
}
