package com.bookati.booking.dto.request;

import com.bookati.booking.service.SlotRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

public record RescheduleRequest(
        @NotBlank @Size(max = 64) String resourceId,
        @NotNull LocalDateTime start,
        @Positive @Max(1440) int durationMinutes
) {

    public SlotRequest toSlotRequest() {
        return new SlotRequest(resourceId, start, durationMinutes);
    }
}
