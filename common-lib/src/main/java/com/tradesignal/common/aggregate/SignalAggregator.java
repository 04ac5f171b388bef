package com.tradesignal.common.aggregate;

import com.tradesignal.common.model.Factor;
import com.tradesignal.common.model.MarketStatus;
import com.tradesignal.common.model.SignalAction;

import java.util.List;

/**
 * Reduces factor votes to one {@link SignalAction} and a confidence percentage.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>{@code totalScore = round(Σ factor.value)} — roughly [−116, +116] with default weights.</li>
 *   <li>Action thresholds, first match wins:
 *       {@code ≥ +strong} STRONG_BUY, {@code ≥ +action} BUY, {@code ≤ −strong} STRONG_SELL,
 *       {@code ≤ −action} SELL, {@code |s| ≤ noTradeBand} NO_TRADE, else SIDEWAYS.</li>
 *   <li>Confidence from a separate per-action mapping (see {@link SignalThresholds}),
 *       not a linear function of the score.</li>
 *   <li>{@link MarketStatusAdjuster} discount when the market is not LIVE.</li>
 *   <li>Rounded to an integer. No further clamping beyond the per-action caps and the floor.</li>
 * </ol>
 *
 * <p>Stateless and thread-safe. Never throws for a well-formed factor list.
 */
public class SignalAggregator {

    private final SignalThresholds thresholds;

    public SignalAggregator(SignalThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public SignalAggregator() {
        this(SignalThresholds.DEFAULTS);
    }

    public AggregateSignal aggregate(List<Factor> factors, MarketStatus marketStatus) {
        double sum = 0.0;
        for (Factor factor : factors) {
            sum += factor.value();
        }
        long totalScore = Math.round(sum);

        SignalAction action = classify(totalScore);
        double confidence = MarketStatusAdjuster.adjust(
            baseConfidence(action, totalScore), marketStatus, thresholds);
        return new AggregateSignal(action, (int) Math.round(confidence), totalScore);
    }

    SignalAction classify(long totalScore) {
        if (totalScore >=  thresholds.strongScore())        return SignalAction.STRONG_BUY;
        if (totalScore >=  thresholds.actionScore())        return SignalAction.BUY;
        if (totalScore <= -thresholds.strongScore())        return SignalAction.STRONG_SELL;
        if (totalScore <= -thresholds.actionScore())        return SignalAction.SELL;
        if (Math.abs(totalScore) <= thresholds.noTradeBand()) return SignalAction.NO_TRADE;
        return SignalAction.SIDEWAYS;
    }

    double baseConfidence(SignalAction action, long totalScore) {
        double magnitude = Math.abs(totalScore);
        return switch (action) {
            case STRONG_BUY, STRONG_SELL -> Math.min(thresholds.strongCap(),
                thresholds.strongBase() + (magnitude - thresholds.strongScore()) * thresholds.strongSlope());
            case BUY, SELL -> Math.min(thresholds.actionCap(),
                thresholds.actionBase() + (magnitude - thresholds.actionScore()) * thresholds.actionSlope());
            case NO_TRADE -> thresholds.noTradeConfidence();
            case SIDEWAYS -> thresholds.sidewaysBase() + magnitude * thresholds.sidewaysSlope();
        };
    }
}
