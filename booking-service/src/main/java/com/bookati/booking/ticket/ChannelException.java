package com.bookati.booking.ticket;

import lombok.Getter;

@Getter
public class ChannelException extends RuntimeException {

    private final TicketChannel channel;

    public ChannelException(TicketChannel channel, String message) {
        super(message);
        this.channel = channel;
    }

    public ChannelException(TicketChannel channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }
}
