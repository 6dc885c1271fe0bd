package com.bookati.booking.ticket.client;

/**
 * Gateway answer for one send. A gateway may accept the request and still refuse the
 * message, which is reported as not delivered rather than thrown.
 */
public record DeliveryResult(boolean delivered, String providerMessageId, String detail) {

    public static DeliveryResult delivered(String providerMessageId) {
        return new DeliveryResult(true, providerMessageId, null);
    }

    public static DeliveryResult rejected(String detail) {
        return new DeliveryResult(false, null, detail);
    }
}
