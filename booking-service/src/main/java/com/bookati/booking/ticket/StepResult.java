package com.bookati.booking.ticket;

public record StepResult(StepOutcome outcome, String detail) {

    public static StepResult notStarted() {
        return new StepResult(StepOutcome.NOT_STARTED, null);
    }

    public static StepResult succeeded(String detail) {
        return new StepResult(StepOutcome.SUCCEEDED, detail);
    }

    public static StepResult failed(String detail) {
        return new StepResult(StepOutcome.FAILED, detail);
    }

    public static StepResult skipped(String detail) {
        return new StepResult(StepOutcome.SKIPPED, detail);
    }
}
