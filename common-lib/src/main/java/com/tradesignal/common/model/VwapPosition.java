package com.tradesignal.common.model;

public enum VwapPosition {
    ABOVE_VWAP,
    BELOW_VWAP,
    AT_VWAP;

    /** Accepts both {@code ABOVE_VWAP} and a bare {@code ABOVE}; unknown reads as {@link #AT_VWAP}. */
    public static VwapPosition from(String raw) {
        String token = EnumTokens.normalize(raw);
        if (token.startsWith("ABOVE")) return ABOVE_VWAP;
        if (token.startsWith("BELOW")) return BELOW_VWAP;
        return AT_VWAP;
    }
}
