package com.bookati.booking.domain;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Identity of a bookable slot. Two bookings collide when their keys are equal.
 */
public record SlotKey(String tenantId, String resourceId, LocalDateTime slotStart) {

    private static final DateTimeFormatter LOCK_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmm");

    public SlotKey {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(slotStart, "slotStart");
        slotStart = slotStart.withSecond(0).withNano(0);
    }

    public String lockName() {
        return "lock:slot:" + tenantId + ":" + resourceId + ":" + LOCK_FORMAT.format(slotStart);
    }

    @Override
    public String toString() {
        return tenantId + "/" + resourceId + "@" + slotStart;
    }
}
