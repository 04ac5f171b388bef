package com.tradesignal.common.model;

/**
 * Five-step categorical signal the backend emits for smart-money flow and candle quality.
 * Consumed as an opaque input; the scorer only cares about its strength and side.
 */
public enum FlowSignal {
    STRONG_BUY,
    BUY,
    NEUTRAL,
    SELL,
    STRONG_SELL;

    public static FlowSignal from(String raw) {
        String token = EnumTokens.normalize(raw);
        for (FlowSignal signal : values()) {
            if (signal.name().equals(token)) return signal;
        }
        return NEUTRAL;
    }
}
