package com.bookati.booking.domain;

import java.util.Locale;

public enum TicketLanguage {
    EN,
    AR;

    /**
     * Resolves a customer language tag; anything other than Arabic falls back to English.
     */
    public static TicketLanguage from(String tag) {
        if (tag == null || tag.isBlank()) {
            return EN;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("ar") || normalized.startsWith("ar-") ? AR : EN;
    }
}
