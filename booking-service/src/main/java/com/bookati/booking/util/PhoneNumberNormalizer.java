package com.bookati.booking.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalizes customer phone numbers to E.164 before they are stored or handed to the
 * WhatsApp gateway. Egyptian local and mis-prefixed forms are rewritten to {@code +20}.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class PhoneNumberNormalizer {

    private static final String EGYPT = "+20";
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-()]");
    private static final Pattern E164 = Pattern.compile("\\+\\d{8,15}");

    public static Optional<String> normalize(String phone) {
        if (phone == null || phone.isBlank()) {
            return Optional.empty();
        }
        String cleaned = SEPARATORS.matcher(phone).replaceAll("");

        if (cleaned.startsWith("00")) {
            cleaned = "+" + cleaned.substring(2);
        }
        if (cleaned.startsWith("+")) {
            return valid(cleaned.startsWith(EGYPT) ? stripTrunkZero(cleaned.substring(3), cleaned) : cleaned);
        }
        // 01XXXXXXXXX
        if (cleaned.startsWith("0") && cleaned.length() == 11 && isEgyptianMobile(cleaned.substring(1))) {
            return valid(EGYPT + cleaned.substring(1));
        }
        // 20XXXXXXXXXX, possibly with a trunk zero after the country code
        if (cleaned.startsWith("20") && cleaned.length() >= 12) {
            return valid(stripTrunkZero(cleaned.substring(2), "+" + cleaned));
        }
        // 1XXXXXXXXX
        if (cleaned.length() == 10 && isEgyptianMobile(cleaned)) {
            return valid(EGYPT + cleaned);
        }
        return Optional.empty();
    }

    private static String stripTrunkZero(String afterCountryCode, String fallback) {
        if (afterCountryCode.startsWith("0") && afterCountryCode.length() >= 10
                && isEgyptianMobile(afterCountryCode.substring(1))) {
            return EGYPT + afterCountryCode.substring(1);
        }
        return fallback;
    }

    private static boolean isEgyptianMobile(String national) {
        return national.startsWith("1") || national.startsWith("2") || national.startsWith("5");
    }

    private static Optional<String> valid(String candidate) {
        return E164.matcher(candidate).matches() ? Optional.of(candidate) : Optional.empty();
    }
}
