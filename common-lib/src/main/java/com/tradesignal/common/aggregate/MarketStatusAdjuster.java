package com.tradesignal.common.aggregate;

import com.tradesignal.common.model.MarketStatus;

/**
 * Uniform confidence discount applied whenever the session is not actively {@code LIVE}
 * (closed, pre-open, freeze or feed offline). The discount never takes confidence below
 * the configured floor; a LIVE market leaves it untouched.
 */
public final class MarketStatusAdjuster {

    private MarketStatusAdjuster() {}

    public static double adjust(double confidence, MarketStatus status, SignalThresholds thresholds) {
        if (status != null && status.isLive()) return confidence;
        return Math.max(thresholds.confidenceFloor(), confidence - thresholds.offMarketPenalty());
    }

    public static double adjust(double confidence, MarketStatus status) {
        return adjust(confidence, status, SignalThresholds.DEFAULTS);
    }
}
