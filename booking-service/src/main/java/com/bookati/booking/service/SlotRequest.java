package com.bookati.booking.service;

import com.bookati.booking.domain.SlotKey;

import java.time.LocalDateTime;

public record SlotRequest(String resourceId, LocalDateTime start, int durationMinutes) {

    public SlotKey toKey(String tenantId) {
        return new SlotKey(tenantId, resourceId, start);
    }
}
