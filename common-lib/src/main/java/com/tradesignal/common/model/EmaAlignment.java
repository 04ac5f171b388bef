package com.tradesignal.common.model;

/**
 * Relative ordering of the fast/medium/slow EMA stack (e.g. 9/21/50).
 */
public enum EmaAlignment {
    ALL_BULLISH,
    PARTIAL_BULLISH,
    ALL_BEARISH,
    PARTIAL_BEARISH,
    NEUTRAL;

    public static EmaAlignment from(String raw) {
        String token = EnumTokens.normalize(raw);
        for (EmaAlignment alignment : values()) {
            if (alignment.name().equals(token)) return alignment;
        }
        return NEUTRAL;
    }

    public boolean isBullish() {
        return this == ALL_BULLISH || this == PARTIAL_BULLISH;
    }

    public boolean isBearish() {
        return this == ALL_BEARISH || this == PARTIAL_BEARISH;
    }
}
