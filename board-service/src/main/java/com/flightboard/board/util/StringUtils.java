package com.flightboard.board.util;

import java.util.Locale;

/**
 * Domain-specific string utilities.
 * For general string operations, prefer org.springframework.util.StringUtils
 */
public final class StringUtils {

    private StringUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Airport, airline and flight codes are stored trimmed and upper-case.
     */
    public static String normalizeCode(String code) {
        if (!org.springframework.util.StringUtils.hasText(code)) {
            return null;
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }

    public static String trimToNull(String value) {
        if (!org.springframework.util.StringUtils.hasText(value)) {
            return null;
        }
        return value.trim();
    }
}
