package com.tradesignal.common.model;

/**
 * Backend classification of live RSI momentum.
 *
 * <p>{@link #NONE} stands for the empty string the backend sends before it has classified
 * anything. Only the four decisive states ({@link #isDecisive()}) override the raw RSI blend.
 */
public enum RsiMomentumStatus {
    STRONG,
    OVERBOUGHT,
    NEUTRAL,
    WEAK,
    OVERSOLD,
    DIVERGENCE,
    NONE;

    public static RsiMomentumStatus from(String raw) {
        String token = EnumTokens.normalize(raw);
        for (RsiMomentumStatus status : values()) {
            if (status != NONE && status.name().equals(token)) return status;
        }
        return NONE;
    }

    public boolean isDecisive() {
        return this == STRONG || this == OVERBOUGHT || this == WEAK || this == OVERSOLD;
    }
}
