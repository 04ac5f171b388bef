package com.tradesignal.common.model;

/**
 * The backend's coarse {@code trend} field, used as a last-resort 15-minute proxy.
 */
public enum MappedTrend {
    UPTREND,
    DOWNTREND,
    SIDEWAYS;

    public static MappedTrend from(String raw) {
        String token = EnumTokens.normalize(raw);
        if (token.equals("UPTREND") || token.equals("UP")) return UPTREND;
        if (token.equals("DOWNTREND") || token.equals("DOWN")) return DOWNTREND;
        return SIDEWAYS;
    }
}
