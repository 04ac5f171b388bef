package com.tradesignal.common.model;

/**
 * Directional call for one timeframe (5-minute or 15-minute).
 */
public enum TrendDirection {
    UP,
    DOWN,
    NEUTRAL;

    /**
     * Parses backend labels such as {@code UP}, {@code STRONG_UP}, {@code DOWNTREND}.
     * Empty or unrecognized labels read as {@link #NEUTRAL}.
     */
    public static TrendDirection from(String raw) {
        String token = EnumTokens.normalize(raw);
        if (token.contains("UP")) return UP;
        if (token.contains("DOWN")) return DOWN;
        return NEUTRAL;
    }

    public boolean isDirectional() {
        return this != NEUTRAL;
    }

    /** True only when both calls are directional and point opposite ways. */
    public boolean opposes(TrendDirection other) {
        return (this == UP && other == DOWN) || (this == DOWN && other == UP);
    }
}
