package com.bookati.booking.dto.response;

import com.bookati.booking.ticket.StepOutcome;
import com.bookati.booking.ticket.StepResult;
import com.bookati.booking.ticket.TicketPipelineResult;

import java.time.LocalDateTime;

public record TicketStatusResponse(
        Long bookingId,
        Step pdf,
        Step whatsapp,
        Step email,
        boolean inFlight,
        boolean partialFailure,
        int runCount,
        LocalDateTime updatedAt
) {
    public record Step(StepOutcome outcome, String detail) {

        static Step from(StepResult result) {
            return new Step(result.outcome(), result.detail());
        }
    }

    public static TicketStatusResponse from(TicketPipelineResult result) {
        return new TicketStatusResponse(
                result.bookingId(),
                Step.from(result.pdf()),
                Step.from(result.whatsapp()),
                Step.from(result.email()),
                result.inFlight(),
                result.partialFailure(),
                result.runCount(),
                result.updatedAt()
        );
    }
}
