package com.tradesignal.common.trend;

import com.tradesignal.common.model.EmaAlignment;
import com.tradesignal.common.model.IndicatorSnapshot;
import com.tradesignal.common.model.IndicatorTrend;
import com.tradesignal.common.model.TrendDirection;

import java.util.List;
import java.util.function.Function;

/**
 * Pure stateless derivation of independent 5-minute and 15-minute directional calls.
 *
 * <p>Backend indicator coverage varies by symbol and market phase, so each timeframe walks
 * an ordered fallback chain: the first link that yields UP or DOWN wins, and only when every
 * link is neutral does the call stay NEUTRAL.
 *
 * <h3>5-minute chain</h3>
 * <pre>
 *   explicit trend_5min → SuperTrend → 5m RSI (≥54 / ≤46) → live RSI (≥58 / ≤42)
 *     → momentum score (≥58 / ≤42) → day change (&gt;0.15% / &lt;−0.15%)
 * </pre>
 *
 * <h3>15-minute chain</h3>
 * <pre>
 *   explicit trend_15min → EMA alignment → trend structure → trend colour
 *     → mapped trend → SAR confirmed by day change (beyond ±0.3%)
 * </pre>
 *
 * <p>The 5m RSI link is skipped while the candle RSI still holds its "no cache" sentinel.
 */
public final class TrendReconciler {

    static final double RSI_5M_UP        = 54;
    static final double RSI_5M_DOWN      = 46;
    static final double RSI_LIVE_UP      = 58;
    static final double RSI_LIVE_DOWN    = 42;
    static final double MOMENTUM_UP      = 58;
    static final double MOMENTUM_DOWN    = 42;
    static final double CHANGE_5M_PCT    = 0.15;
    static final double SAR_CHANGE_PCT   = 0.3;

    private record Link(TrendSource source, Function<IndicatorSnapshot, TrendDirection> rule) {}

    private static final List<Link> CHAIN_5M = List.of(
        new Link(TrendSource.EXPLICIT_5M, IndicatorSnapshot::getTrend5minRaw),
        new Link(TrendSource.SUPERTREND,  s -> fromIndicator(s.getSuperTrendTrend())),
        new Link(TrendSource.RSI_5M,      TrendReconciler::fromRsi5m),
        new Link(TrendSource.RSI_LIVE,    s -> fromBand(s.getRsiLive(), RSI_LIVE_UP, RSI_LIVE_DOWN)),
        new Link(TrendSource.MOMENTUM,    s -> fromBand(s.getMomentum(), MOMENTUM_UP, MOMENTUM_DOWN)),
        new Link(TrendSource.DAY_CHANGE,  TrendReconciler::fromDayChange)
    );

    private static final List<Link> CHAIN_15M = List.of(
        new Link(TrendSource.EXPLICIT_15M,    IndicatorSnapshot::getTrend15minRaw),
        new Link(TrendSource.EMA_ALIGNMENT,   s -> fromAlignment(s.getEmaAlignment())),
        new Link(TrendSource.TREND_STRUCTURE, TrendReconciler::fromStructure),
        new Link(TrendSource.TREND_COLOR,     s -> fromIndicator(s.getTrendColor())),
        new Link(TrendSource.TREND_MAPPED,    TrendReconciler::fromMapped),
        new Link(TrendSource.SAR_CHANGE,      TrendReconciler::fromSarAndChange)
    );

    private TrendReconciler() {}

    public static TrendDirection deriveTrend5min(IndicatorSnapshot s) {
        return resolve5min(s).direction();
    }

    public static TrendDirection deriveTrend15min(IndicatorSnapshot s) {
        return resolve15min(s).direction();
    }

    public static TrendCall resolve5min(IndicatorSnapshot s) {
        return walk(CHAIN_5M, s);
    }

    public static TrendCall resolve15min(IndicatorSnapshot s) {
        return walk(CHAIN_15M, s);
    }

    private static TrendCall walk(List<Link> chain, IndicatorSnapshot s) {
        for (Link link : chain) {
            TrendDirection direction = link.rule().apply(s);
            if (direction != null && direction.isDirectional()) {
                return TrendCall.of(direction, link.source());
            }
        }
        return TrendCall.UNDECIDED;
    }

    // ── 5-minute rules ───────────────────────────────────────────────────────

    static TrendDirection fromRsi5m(IndicatorSnapshot s) {
        double rsi = s.getRsi5mRaw();
        if (rsi == IndicatorSnapshot.RSI_SENTINEL) return TrendDirection.NEUTRAL;
        return fromBand(rsi, RSI_5M_UP, RSI_5M_DOWN);
    }

    static TrendDirection fromDayChange(IndicatorSnapshot s) {
        double change = s.getChangePercent();
        if (change >  CHANGE_5M_PCT) return TrendDirection.UP;
        if (change < -CHANGE_5M_PCT) return TrendDirection.DOWN;
        return TrendDirection.NEUTRAL;
    }

    // ── 15-minute rules ──────────────────────────────────────────────────────

    static TrendDirection fromAlignment(EmaAlignment alignment) {
        if (alignment.isBullish()) return TrendDirection.UP;
        if (alignment.isBearish()) return TrendDirection.DOWN;
        return TrendDirection.NEUTRAL;
    }

    static TrendDirection fromStructure(IndicatorSnapshot s) {
        return switch (s.getTrendStructure()) {
            case HIGHER_HIGHS_LOWS -> TrendDirection.UP;
            case LOWER_HIGHS_LOWS  -> TrendDirection.DOWN;
            case SIDEWAYS          -> TrendDirection.NEUTRAL;
        };
    }

    static TrendDirection fromMapped(IndicatorSnapshot s) {
        return switch (s.getTrendMapped()) {
            case UPTREND   -> TrendDirection.UP;
            case DOWNTREND -> TrendDirection.DOWN;
            case SIDEWAYS  -> TrendDirection.NEUTRAL;
        };
    }

    static TrendDirection fromSarAndChange(IndicatorSnapshot s) {
        double change = s.getChangePercent();
        if (s.getSarTrend() == IndicatorTrend.BEARISH && change < -SAR_CHANGE_PCT) return TrendDirection.DOWN;
        if (s.getSarTrend() == IndicatorTrend.BULLISH && change >  SAR_CHANGE_PCT) return TrendDirection.UP;
        return TrendDirection.NEUTRAL;
    }

    // ── shared ───────────────────────────────────────────────────────────────

    static TrendDirection fromIndicator(IndicatorTrend trend) {
        return switch (trend) {
            case BULLISH -> TrendDirection.UP;
            case BEARISH -> TrendDirection.DOWN;
            case NEUTRAL -> TrendDirection.NEUTRAL;
        };
    }

    static TrendDirection fromBand(double value, double upAtOrAbove, double downAtOrBelow) {
        if (value >= upAtOrAbove)   return TrendDirection.UP;
        if (value <= downAtOrBelow) return TrendDirection.DOWN;
        return TrendDirection.NEUTRAL;
    }
}
