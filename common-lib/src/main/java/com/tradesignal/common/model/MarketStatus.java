package com.tradesignal.common.model;

/**
 * Exchange session state as reported by the market-data collaborator.
 * Anything other than {@link #LIVE} discounts confidence uniformly.
 */
public enum MarketStatus {
    LIVE,
    CLOSED,
    OFFLINE,
    PRE_OPEN,
    FREEZE;

    /** Unknown or missing statuses are treated as {@link #OFFLINE}, never as LIVE. */
    public static MarketStatus from(String raw) {
        String token = EnumTokens.normalize(raw);
        for (MarketStatus status : values()) {
            if (status.name().equals(token)) return status;
        }
        return OFFLINE;
    }

    public boolean isLive() {
        return this == LIVE;
    }
}
