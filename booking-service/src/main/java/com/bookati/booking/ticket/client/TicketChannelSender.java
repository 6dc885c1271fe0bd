package com.bookati.booking.ticket.client;

import com.bookati.booking.ticket.ChannelException;
import com.bookati.booking.ticket.TicketAttachment;
import com.bookati.booking.ticket.TicketChannel;
import com.bookati.booking.ticket.TicketSnapshot;

import java.util.Optional;

public interface TicketChannelSender {

    TicketChannel channel();

    /** Where this channel delivers for the booking; empty when the customer gave no such contact. */
    Optional<String> destination(TicketSnapshot snapshot);

    /**
     * @throws ChannelException on transport or gateway errors
     */
    DeliveryResult send(TicketAttachment attachment, String destination);
}
