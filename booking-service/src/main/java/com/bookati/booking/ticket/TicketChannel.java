package com.bookati.booking.ticket;

/**
 * Pipeline steps in execution order. PDF is the prerequisite of the two delivery channels.
 */
public enum TicketChannel {
    PDF(null),
    WHATSAPP("phone number"),
    EMAIL("email address");

    private final String destinationName;

    TicketChannel(String destinationName) {
        this.destinationName = destinationName;
    }

    /** Step detail recorded when the booking carries no destination for this channel. */
    public String missingDestinationDetail() {
        return "no " + destinationName + " on booking";
    }

    public boolean isDelivery() {
        return this != PDF;
    }
}
