package com.bookati.booking.ticket.client;

import com.bookati.booking.ticket.RenderException;
import com.bookati.booking.ticket.TicketSnapshot;

public interface TicketRenderer {

    /**
     * @return the PDF bytes of the ticket
     * @throws RenderException when the document could not be produced
     */
    byte[] render(TicketSnapshot snapshot);
}
