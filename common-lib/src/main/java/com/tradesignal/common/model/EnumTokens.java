package com.tradesignal.common.model;

import java.util.Locale;

/**
 * Normalizes the loosely formatted enum strings the indicator backend emits
 * ({@code "strong buy"}, {@code "ALL-BULLISH"}, {@code " Above_Vwap "}) into
 * upper-case, underscore-separated tokens. {@code null} becomes {@code ""}.
 */
final class EnumTokens {

    private EnumTokens() {}

    static String normalize(String raw) {
        if (raw == null) return "";
        return raw.trim()
                  .toUpperCase(Locale.ROOT)
                  .replace('-', '_')
                  .replace(' ', '_');
    }
}
