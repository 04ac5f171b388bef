package com.tradesignal.common.aggregate;

/**
 * Tunable score thresholds and confidence coefficients for {@link SignalAggregator}.
 *
 * <p>The defaults were chosen empirically on index intraday data; they carry no derivation.
 * Keeping them here, named, rather than inline makes them testable and overridable from
 * configuration.
 *
 * <pre>
 *   |score| ≥ strongScore   → STRONG_*   confidence = min(strongCap, strongBase + (|s| − strongScore) × strongSlope)
 *   |score| ≥ actionScore   → BUY / SELL confidence = min(actionCap, actionBase + (|s| − actionScore) × actionSlope)
 *   |score| ≤ noTradeBand   → NO_TRADE   confidence = noTradeConfidence
 *   otherwise               → SIDEWAYS   confidence = sidewaysBase + |s| × sidewaysSlope
 *   market not LIVE         → confidence = max(confidenceFloor, confidence − offMarketPenalty)
 * </pre>
 */
public record SignalThresholds(
    double strongScore,
    double actionScore,
    double noTradeBand,
    double strongBase,
    double strongSlope,
    double strongCap,
    double actionBase,
    double actionSlope,
    double actionCap,
    double noTradeConfidence,
    double sidewaysBase,
    double sidewaysSlope,
    double offMarketPenalty,
    double confidenceFloor
) {
    public static final SignalThresholds DEFAULTS = new SignalThresholds(
        48, 18, 8,
        68, 0.54, 95,
        52, 1.07, 84,
        50,
        42, 0.5,
        15, 30
    );

    public SignalThresholds {
        if (!(strongScore > actionScore && actionScore > noTradeBand && noTradeBand >= 0)) {
            throw new IllegalArgumentException(String.format(
                "thresholds must satisfy strong > action > noTrade >= 0 (got %s / %s / %s)",
                strongScore, actionScore, noTradeBand));
        }
        if (confidenceFloor < 0 || confidenceFloor > strongCap) {
            throw new IllegalArgumentException("confidenceFloor must lie in [0, strongCap], got " + confidenceFloor);
        }
    }
}
