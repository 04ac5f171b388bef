package com.tradesignal.common.prediction;

import com.tradesignal.common.model.Prediction;
import com.tradesignal.common.model.PredictionDirection;
import com.tradesignal.common.model.TrendDirection;

/**
 * Pure stateless composer of the short-horizon (next 5 minutes) forecast.
 *
 * <h3>Direction</h3>
 * Both timeframes agree and are directional → that direction; otherwise the 5m call when it
 * is directional; otherwise the 15m call; otherwise FLAT.
 *
 * <h3>Confidence</h3>
 * <pre>
 *   aligned (or both neutral)  → unchanged
 *   conflict (UP vs DOWN)      → max(30, confidence − 12)
 *   only one side directional  → max(30, confidence − 6)
 * </pre>
 */
public final class PredictionComposer {

    static final int CONFLICT_PENALTY = 12;
    static final int PARTIAL_PENALTY  = 6;
    static final int FLOOR            = 30;

    public static final String NOTE_ALIGNED   = "5m + 15m aligned";
    public static final String NOTE_CONFLICT  = "⚠ 5m vs 15m conflict";
    public static final String NOTE_5M_ONLY   = "5m signal · 15m neutral";
    public static final String NOTE_15M_ONLY  = "15m trend · 5m neutral";
    public static final String NOTE_NO_SIGNAL = "No clear direction";

    private PredictionComposer() {}

    public static Prediction composePrediction(TrendDirection trend5min, TrendDirection trend15min,
                                               int confidence) {
        Agreement agreement = Agreement.classify(trend5min, trend15min);

        PredictionDirection direction;
        if (agreement == Agreement.ALIGNED)   direction = PredictionDirection.of(trend5min);
        else if (trend5min.isDirectional())   direction = PredictionDirection.of(trend5min);
        else                                  direction = PredictionDirection.of(trend15min);

        int adjusted = switch (agreement) {
            case ALIGNED, NEITHER       -> confidence;
            case CONFLICT              -> Math.max(FLOOR, confidence - CONFLICT_PENALTY);
            case ONLY_5M, ONLY_15M     -> Math.max(FLOOR, confidence - PARTIAL_PENALTY);
        };

        return new Prediction(direction, adjusted, agreement.note);
    }

    /** How the two timeframe calls relate to each other. */
    public enum Agreement {
        ALIGNED(NOTE_ALIGNED),
        CONFLICT(NOTE_CONFLICT),
        ONLY_5M(NOTE_5M_ONLY),
        ONLY_15M(NOTE_15M_ONLY),
        NEITHER(NOTE_NO_SIGNAL);

        private final String note;

        Agreement(String note) {
            this.note = note;
        }

        public static Agreement classify(TrendDirection trend5min, TrendDirection trend15min) {
            boolean has5m  = trend5min.isDirectional();
            boolean has15m = trend15min.isDirectional();
            if (has5m && has15m) return trend5min.opposes(trend15min) ? CONFLICT : ALIGNED;
            if (has5m)  return ONLY_5M;
            if (has15m) return ONLY_15M;
            return NEITHER;
        }
    }
}
