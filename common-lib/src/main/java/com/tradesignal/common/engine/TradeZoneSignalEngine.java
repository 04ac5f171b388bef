package com.tradesignal.common.engine;

import com.tradesignal.common.aggregate.AggregateSignal;
import com.tradesignal.common.aggregate.SignalAggregator;
import com.tradesignal.common.aggregate.SignalThresholds;
import com.tradesignal.common.model.Factor;
import com.tradesignal.common.model.IndicatorSnapshot;
import com.tradesignal.common.model.MarketStatus;
import com.tradesignal.common.model.Prediction;
import com.tradesignal.common.model.SignalResult;
import com.tradesignal.common.model.TrendDirection;
import com.tradesignal.common.prediction.PredictionComposer;
import com.tradesignal.common.scoring.FactorScorer;
import com.tradesignal.common.snapshot.SnapshotSanitizer;
import com.tradesignal.common.trend.TrendReconciler;
import com.tradesignal.common.zone.ZoneLocator;

import java.util.List;

/**
 * Default {@link SignalEngine}: the ten-factor weighted scoring used by the trade-zones card.
 *
 * <h3>Pipeline</h3>
 * <ol>
 *   <li>{@link SnapshotSanitizer} — NaN / null fields back to neutral sentinels</li>
 *   <li>{@link FactorScorer} — ten bounded votes</li>
 *   <li>{@link TrendReconciler} — independent 5m and 15m calls</li>
 *   <li>{@link SignalAggregator} — action, confidence, market-status discount</li>
 *   <li>{@link PredictionComposer} — short-horizon forecast from both calls and the confidence</li>
 *   <li>{@link ZoneLocator} — support/resistance context for display</li>
 * </ol>
 */
public class TradeZoneSignalEngine implements SignalEngine {

    private final SignalAggregator aggregator;

    public TradeZoneSignalEngine(SignalThresholds thresholds) {
        this.aggregator = new SignalAggregator(thresholds);
    }

    public TradeZoneSignalEngine() {
        this(SignalThresholds.DEFAULTS);
    }

    @Override
    public SignalResult evaluate(IndicatorSnapshot snapshot, MarketStatus marketStatus) {
        IndicatorSnapshot s = SnapshotSanitizer.sanitize(snapshot);
        MarketStatus status = marketStatus != null ? marketStatus : MarketStatus.OFFLINE;

        List<Factor> factors = FactorScorer.score(s);
        TrendDirection trend5min  = TrendReconciler.resolve5min(s).direction();
        TrendDirection trend15min = TrendReconciler.resolve15min(s).direction();

        AggregateSignal signal = aggregator.aggregate(factors, status);
        Prediction prediction = PredictionComposer.composePrediction(
            trend5min, trend15min, signal.confidence());

        return new SignalResult(
            signal.action(),
            signal.confidence(),
            signal.totalScore(),
            factors,
            trend5min,
            trend15min,
            prediction,
            status,
            ZoneLocator.locate(s)
        );
    }
}
