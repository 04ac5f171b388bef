package com.tradesignal.common.model;

/**
 * Swing structure of recent candles.
 */
public enum TrendStructure {
    HIGHER_HIGHS_LOWS,
    LOWER_HIGHS_LOWS,
    SIDEWAYS;

    public static TrendStructure from(String raw) {
        String token = EnumTokens.normalize(raw);
        if (token.startsWith("HIGHER_HIGH")) return HIGHER_HIGHS_LOWS;
        if (token.startsWith("LOWER_HIGH")) return LOWER_HIGHS_LOWS;
        return SIDEWAYS;
    }
}
