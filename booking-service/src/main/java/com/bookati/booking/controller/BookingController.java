package com.bookati.booking.controller;

import com.bookati.booking.dto.request.CreateBookingRequest;
import com.bookati.booking.dto.request.RescheduleRequest;
import com.bookati.booking.dto.response.BookingResponse;
import com.bookati.booking.service.BookingService;
import com.bookati.common.response.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Booking", description = "Slot-safe booking creation, checkout holds and booking lifecycle")
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    static final String TENANT_HEADER = "X-Tenant-Id";

    private final BookingService bookingService;

    @Operation(summary = "Create booking", description = "Book a slot directly; the booking is confirmed and its ticket is sent")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Booking confirmed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error or invalid package"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Slot already taken"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Storage temporarily unavailable, safe to retry")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<BookingResponse>> createBooking(
            @Parameter(hidden = true) @RequestHeader(TENANT_HEADER) String tenantId,
            @Valid @RequestBody CreateBookingRequest request) {
        var booking = bookingService.createBooking(tenantId, request.toSlotRequest(),
                request.toCustomerDetails(), request.toSelection());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(BookingResponse.from(booking)));
    }

    @Operation(summary = "Hold slot", description = "Reserve a slot during checkout; the hold expires unless confirmed")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Slot held"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error or invalid package"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Slot already taken"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Storage temporarily unavailable, safe to retry")
    })
    @PostMapping("/hold")
    public ResponseEntity<ApiResponse<BookingResponse>> holdSlot(
            @Parameter(hidden = true) @RequestHeader(TENANT_HEADER) String tenantId,
            @Valid @RequestBody CreateBookingRequest request) {
        var booking = bookingService.holdSlot(tenantId, request.toSlotRequest(),
                request.toCustomerDetails(), request.toSelection());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(BookingResponse.from(booking)));
    }

    @Operation(summary = "Confirm booking", description = "Confirm a held booking before its hold expires")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking confirmed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Hold expired"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Booking was cancelled")
    })
    @PostMapping("/{bookingId}/confirm")
    public ResponseEntity<ApiResponse<BookingResponse>> confirmBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader(TENANT_HEADER) String tenantId) {
        var booking = bookingService.confirmBooking(bookingId, tenantId);
        return ResponseEntity.ok(ApiResponse.ok(BookingResponse.from(booking)));
    }

    @Operation(summary = "Cancel booking", description = "Cancel a booking and free its slot")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking cancelled"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found")
    })
    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<ApiResponse<BookingResponse>> cancelBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader(TENANT_HEADER) String tenantId) {
        var booking = bookingService.cancelBooking(bookingId, tenantId);
        return ResponseEntity.ok(ApiResponse.ok(BookingResponse.from(booking)));
    }

    @Operation(summary = "Reschedule booking", description = "Move an active booking to another slot; a confirmed booking gets a new ticket")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking moved"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "New slot taken or booking cancelled")
    })
    @PostMapping("/{bookingId}/reschedule")
    public ResponseEntity<ApiResponse<BookingResponse>> rescheduleBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader(TENANT_HEADER) String tenantId,
            @Valid @RequestBody RescheduleRequest request) {
        var booking = bookingService.rescheduleBooking(bookingId, tenantId, request.toSlotRequest());
        return ResponseEntity.ok(ApiResponse.ok(BookingResponse.from(booking)));
    }

    @Operation(summary = "Get booking", description = "Get booking details by ID")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found")
    })
    @GetMapping("/{bookingId}")
    public ResponseEntity<ApiResponse<BookingResponse>> getBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader(TENANT_HEADER) String tenantId) {
        var booking = bookingService.getBooking(bookingId, tenantId);
        return ResponseEntity.ok(ApiResponse.ok(BookingResponse.from(booking)));
    }
}
