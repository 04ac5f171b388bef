package com.tradesignal.common.model;

/**
 * Three-state reading shared by SuperTrend, Parabolic SAR and the backend's trend-colour proxy.
 */
public enum IndicatorTrend {
    BULLISH,
    BEARISH,
    NEUTRAL;

    /** Any label containing BULL / BEAR is accepted; everything else reads as NEUTRAL. */
    public static IndicatorTrend from(String raw) {
        String token = EnumTokens.normalize(raw);
        if (token.contains("BULL")) return BULLISH;
        if (token.contains("BEAR")) return BEARISH;
        return NEUTRAL;
    }

    public int sign() {
        return switch (this) {
            case BULLISH -> 1;
            case BEARISH -> -1;
            case NEUTRAL -> 0;
        };
    }
}
