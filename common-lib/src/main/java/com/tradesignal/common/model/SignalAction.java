package com.tradesignal.common.model;

/**
 * The six discrete trade actions a signal evaluation can end in.
 *
 * <ul>
 *   <li>{@link #STRONG_BUY} / {@link #STRONG_SELL} — score at or beyond the strong threshold</li>
 *   <li>{@link #BUY} / {@link #SELL}               — score at or beyond the normal threshold</li>
 *   <li>{@link #NO_TRADE}                          — score inside the dead zone around zero</li>
 *   <li>{@link #SIDEWAYS}                          — leaning, but not enough to act on</li>
 * </ul>
 */
public enum SignalAction {
    STRONG_BUY,
    BUY,
    NO_TRADE,
    SIDEWAYS,
    SELL,
    STRONG_SELL;

    public boolean isBuy() {
        return this == BUY || this == STRONG_BUY;
    }

    public boolean isSell() {
        return this == SELL || this == STRONG_SELL;
    }
}
