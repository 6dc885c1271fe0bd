package com.bookati.booking.controller;

import com.bookati.booking.dto.response.DeliveryAttemptResponse;
import com.bookati.booking.dto.response.TicketStatusResponse;
import com.bookati.booking.ticket.TicketChannel;
import com.bookati.booking.ticket.TicketPipelineService;
import com.bookati.common.response.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Ticket", description = "Ticket generation and delivery status")
@RestController
@RequestMapping("/api/v1/bookings/{bookingId}/ticket")
@RequiredArgsConstructor
public class TicketController {

    private final TicketPipelineService ticketPipelineService;

    @Operation(summary = "Ticket status", description = "Per-step outcome of the last ticket pipeline run")
    @GetMapping
    public ResponseEntity<ApiResponse<TicketStatusResponse>> getTicketStatus(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader(BookingController.TENANT_HEADER) String tenantId) {
        var result = ticketPipelineService.getTicketStatus(bookingId, tenantId);
        return ResponseEntity.ok(ApiResponse.ok(TicketStatusResponse.from(result)));
    }

    @Operation(summary = "Delivery attempts", description = "Audit trail of every executed pipeline step, oldest first")
    @GetMapping("/attempts")
    public ResponseEntity<ApiResponse<List<DeliveryAttemptResponse>>> getDeliveryAttempts(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader(BookingController.TENANT_HEADER) String tenantId) {
        var attempts = ticketPipelineService.getDeliveryAttempts(bookingId, tenantId).stream()
                .map(DeliveryAttemptResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(attempts));
    }

    @Operation(summary = "Regenerate ticket", description = "Render a new PDF and send it over every channel")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Pipeline finished, see step outcomes"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Booking not confirmed or pipeline already running")
    })
    @PostMapping("/regenerate")
    public ResponseEntity<ApiResponse<TicketStatusResponse>> regenerateTicket(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader(BookingController.TENANT_HEADER) String tenantId) {
        var result = ticketPipelineService.regenerateTicket(bookingId, tenantId);
        return ResponseEntity.ok(ApiResponse.ok(TicketStatusResponse.from(result)));
    }

    @Operation(summary = "Redeliver ticket", description = "Send the already generated PDF over one channel again")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Delivery attempted, see step outcome"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Not a delivery channel"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "No ticket generated yet or pipeline already running")
    })
    @PostMapping("/redeliver")
    public ResponseEntity<ApiResponse<TicketStatusResponse>> redeliverTicket(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader(BookingController.TENANT_HEADER) String tenantId,
            @RequestParam TicketChannel channel) {
        var result = ticketPipelineService.redeliverTicket(bookingId, tenantId, channel);
        return ResponseEntity.ok(ApiResponse.ok(TicketStatusResponse.from(result)));
    }
}
