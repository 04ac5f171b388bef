package com.tradesignal.common.model;

import lombok.Builder;
import lombok.Value;

/**
 * Latest indicator values for one tradable symbol, as supplied by the market-data backend.
 *
 * <p>Immutable per evaluation. Every field defaults to a neutral sentinel so that a
 * partially populated snapshot is always scoreable:
 * <ul>
 *   <li>prices, VWAP, EMA-200, support, resistance — {@code 0} means unknown</li>
 *   <li>{@code rsiLive}, {@code rsi5mRaw}, {@code rsi15mRaw}, {@code momentum} — {@code 50}
 *       (for the candle RSIs, 50 also means "no candle cache yet")</li>
 *   <li>enums — their NEUTRAL / empty constant</li>
 *   <li>{@code volumeStrength} — {@code ""}</li>
 * </ul>
 *
 * <p>Numeric fields are not checked for NaN here; see
 * {@link com.tradesignal.common.snapshot.SnapshotSanitizer}.
 */
@Value
@Builder(toBuilder = true)
public class IndicatorSnapshot {

    public static final double RSI_SENTINEL      = 50.0;
    public static final double MOMENTUM_SENTINEL = 50.0;

    @Builder.Default double price = 0.0;
    @Builder.Default double changePercent = 0.0;

    @Builder.Default double rsiLive = RSI_SENTINEL;
    @Builder.Default double rsi5mRaw = RSI_SENTINEL;
    @Builder.Default double rsi15mRaw = RSI_SENTINEL;
    @Builder.Default RsiMomentumStatus rsiMomentumStatus = RsiMomentumStatus.NONE;

    @Builder.Default EmaAlignment emaAlignment = EmaAlignment.NEUTRAL;
    @Builder.Default double vwap = 0.0;
    @Builder.Default VwapPosition vwapPosition = VwapPosition.AT_VWAP;
    @Builder.Default double ema200 = 0.0;

    @Builder.Default IndicatorTrend superTrendTrend = IndicatorTrend.NEUTRAL;
    @Builder.Default IndicatorTrend sarTrend = IndicatorTrend.NEUTRAL;
    @Builder.Default TrendStructure trendStructure = TrendStructure.SIDEWAYS;
    @Builder.Default IndicatorTrend trendColor = IndicatorTrend.NEUTRAL;
    @Builder.Default MappedTrend trendMapped = MappedTrend.SIDEWAYS;

    @Builder.Default FlowSignal smartMoneySignal = FlowSignal.NEUTRAL;
    @Builder.Default FlowSignal candleQualitySignal = FlowSignal.NEUTRAL;
    @Builder.Default String volumeStrength = "";

    @Builder.Default double support = 0.0;
    @Builder.Default double resistance = 0.0;
    @Builder.Default double momentum = MOMENTUM_SENTINEL;

    @Builder.Default TrendDirection trend5minRaw = TrendDirection.NEUTRAL;
    @Builder.Default TrendDirection trend15minRaw = TrendDirection.NEUTRAL;

    /** A snapshot with every field at its sentinel. */
    public static IndicatorSnapshot neutral() {
        return IndicatorSnapshot.builder().build();
    }
}
