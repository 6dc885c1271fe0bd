package com.bookati.booking.ticket;

import java.time.LocalDateTime;
import java.util.stream.Stream;

/**
 * Per-booking view of the ticket pipeline as persisted in {@code ticket_pipelines}.
 * Re-reading it after completion always yields the same value until the pipeline is invoked again.
 */
public record TicketPipelineResult(
        Long bookingId,
        StepResult pdf,
        StepResult whatsapp,
        StepResult email,
        int runCount,
        LocalDateTime updatedAt
) {

    public static TicketPipelineResult notStarted(Long bookingId) {
        return new TicketPipelineResult(bookingId, StepResult.notStarted(), StepResult.notStarted(),
                StepResult.notStarted(), 0, null);
    }

    public StepResult step(TicketChannel channel) {
        return switch (channel) {
            case PDF -> pdf;
            case WHATSAPP -> whatsapp;
            case EMAIL -> email;
        };
    }

    public boolean inFlight() {
        return steps().anyMatch(step -> step.outcome() == StepOutcome.IN_PROGRESS);
    }

    public boolean pdfReady() {
        return pdf.outcome() == StepOutcome.SUCCEEDED;
    }

    /** True once every step reached a terminal outcome and at least one did not succeed. */
    public boolean partialFailure() {
        return steps().allMatch(step -> step.outcome().isTerminal())
                && steps().anyMatch(step -> step.outcome() != StepOutcome.SUCCEEDED);
    }

    private Stream<StepResult> steps() {
        return Stream.of(pdf, whatsapp, email);
    }
}
