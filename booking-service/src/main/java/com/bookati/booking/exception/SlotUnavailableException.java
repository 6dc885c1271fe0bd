package com.bookati.booking.exception;

import com.bookati.booking.domain.SlotKey;
import com.bookati.common.exception.BusinessException;
import com.bookati.common.response.ErrorCode;
import lombok.Getter;

/**
 * The requested slot is held by another active booking, or its lock could not be obtained in time.
 * Expected under contention and never retried internally.
 */
@Getter
public class SlotUnavailableException extends BusinessException {

    private final SlotKey slot;

    public SlotUnavailableException(SlotKey slot) {
        super(ErrorCode.SLOT_UNAVAILABLE, "Slot is not available: " + slot);
        this.slot = slot;
    }

    public SlotUnavailableException(SlotKey slot, String reason) {
        super(ErrorCode.SLOT_UNAVAILABLE, "Slot is not available: " + slot + " (" + reason + ")");
        this.slot = slot;
    }
}
