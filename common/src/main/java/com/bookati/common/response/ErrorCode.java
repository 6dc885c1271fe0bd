package com.bookati.common.response;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(400, "C001", "Invalid input"),
    RESOURCE_NOT_FOUND(404, "C002", "Resource not found"),
    INTERNAL_ERROR(500, "C003", "Internal server error"),
    FORBIDDEN(403, "C005", "Forbidden"),

    // Booking
    SLOT_UNAVAILABLE(409, "B001", "Slot is not available"),
    INVALID_PACKAGE(400, "B002", "Package is not valid for booking"),
    BOOKING_NOT_FOUND(404, "B003", "Booking not found"),
    BOOKING_EXPIRED(400, "B004", "Booking hold has expired"),
    INVALID_BOOKING_STATE(409, "B005", "Booking is not in a valid state for this operation"),
    TRANSIENT_STORAGE(503, "B006", "Storage temporarily unavailable, retry the request"),

    // Ticket
    TICKET_NOT_READY(409, "T001", "Ticket document has not been generated yet"),
    TICKET_PIPELINE_BUSY(409, "T002", "Ticket pipeline is already running for this booking");

    private final int status;
    private final String code;
    private final String message;
}
