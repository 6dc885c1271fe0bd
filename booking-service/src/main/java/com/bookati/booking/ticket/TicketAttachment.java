package com.bookati.booking.ticket;

import com.bookati.booking.domain.TicketLanguage;

/**
 * The generated ticket as handed to a channel sender.
 */
public record TicketAttachment(
        TicketSnapshot booking,
        String fileName,
        byte[] content,
        TicketReason reason
) {

    public static final String CONTENT_TYPE = "application/pdf";

    public static TicketAttachment of(TicketSnapshot booking, byte[] content, TicketReason reason) {
        return new TicketAttachment(booking, TicketMessages.fileName(booking.bookingId()), content, reason);
    }

    public TicketLanguage language() {
        return booking.language();
    }
}
