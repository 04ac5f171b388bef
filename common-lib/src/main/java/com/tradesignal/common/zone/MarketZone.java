package com.tradesignal.common.zone;

/**
 * Where price sits relative to the backend's intraday support and resistance levels.
 */
public enum MarketZone {
    NEAR_SUPPORT,
    NEAR_RESISTANCE,
    MID_RANGE,
    IN_RANGE,
    OUTSIDE_RANGE,
    UNKNOWN
}
