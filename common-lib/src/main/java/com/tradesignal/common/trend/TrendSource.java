package com.tradesignal.common.trend;

/**
 * The link in a fallback chain that produced a timeframe call.
 * {@link #NONE} means every link in the chain was neutral.
 */
public enum TrendSource {
    // 5-minute chain
    EXPLICIT_5M,
    SUPERTREND,
    RSI_5M,
    RSI_LIVE,
    MOMENTUM,
    DAY_CHANGE,

    // 15-minute chain
    EXPLICIT_15M,
    EMA_ALIGNMENT,
    TREND_STRUCTURE,
    TREND_COLOR,
    TREND_MAPPED,
    SAR_CHANGE,

    NONE
}
