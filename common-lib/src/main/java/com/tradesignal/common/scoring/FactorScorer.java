package com.tradesignal.common.scoring;

import com.tradesignal.common.model.EmaAlignment;
import com.tradesignal.common.model.Factor;
import com.tradesignal.common.model.FlowSignal;
import com.tradesignal.common.model.IndicatorSnapshot;
import com.tradesignal.common.model.IndicatorTrend;
import com.tradesignal.common.model.RsiMomentumStatus;
import com.tradesignal.common.model.VwapPosition;

import java.util.List;
import java.util.Locale;

/**
 * Pure stateless scorer that turns one {@link IndicatorSnapshot} into ten bounded
 * {@link Factor} votes.
 *
 * <h3>Factors (fixed display order)</h3>
 * <pre>
 *   #  factor             max   rule
 *   1  SuperTrend         ±20   BULLISH +20, BEARISH −20
 *   2  RSI Dual-TF        ±15   STRONG +15, OVERBOUGHT +6, WEAK −15, OVERSOLD −8,
 *                               otherwise (blendedRsi − 50) × 0.75
 *   3  EMA Stack          ±15   ALL ±15, PARTIAL ±8
 *   4  VWAP               ±15   round(distancePct × 12), or ±10 from the position label
 *   5  Day Change         ±12   stepped ±5 / ±9 / ±12, linear ×4 inside ±0.2%
 *   6  EMA-200            ±8    −8 clearly below, −4 just below, +4 well above, else 0
 *   7  Parabolic SAR      ±10   BULLISH +10, BEARISH −10
 *   8  Smart Money        ±8    STRONG ±8, plain ±5
 *   9  Candle Quality     ±7    STRONG ±7, plain ±4
 *  10  Volume Conviction  ±6    strong volume ±6 with the move, above-average ±3,
 *                               weak volume ∓2 against the move
 * </pre>
 *
 * <p>Every factor clamps itself to its weight. There is no cross-factor normalization, and
 * the order only matters for display since the aggregator simply sums the values.
 * Expects a sanitized snapshot.
 */
public final class FactorScorer {

    public static final String SUPERTREND     = "SuperTrend";
    public static final String RSI_DUAL_TF    = "RSI Dual-TF";
    public static final String EMA_STACK      = "EMA Stack";
    public static final String VWAP           = "VWAP";
    public static final String DAY_CHANGE     = "Day Change";
    public static final String EMA_200        = "EMA-200";
    public static final String PARABOLIC_SAR  = "Parabolic SAR";
    public static final String SMART_MONEY    = "Smart Money";
    public static final String CANDLE_QUALITY = "Candle Quality";
    public static final String VOLUME         = "Volume Conviction";

    static final double SUPERTREND_WEIGHT     = 20;
    static final double RSI_WEIGHT            = 15;
    static final double EMA_STACK_WEIGHT      = 15;
    static final double VWAP_WEIGHT           = 15;
    static final double DAY_CHANGE_WEIGHT     = 12;
    static final double EMA200_WEIGHT         = 8;
    static final double SAR_WEIGHT            = 10;
    static final double SMART_MONEY_WEIGHT    = 8;
    static final double CANDLE_QUALITY_WEIGHT = 7;
    static final double VOLUME_WEIGHT         = 6;

    static final double RSI_OVERBOUGHT_SCORE = 6;
    static final double RSI_OVERSOLD_SCORE   = -8;
    /** Points per RSI point away from 50: a 20-point deviation earns the full weight. */
    static final double RSI_BLEND_SLOPE      = 0.75;

    static final double EMA_PARTIAL_SCORE    = 8;

    static final double VWAP_POINTS_PER_PCT  = 12;
    static final double VWAP_POSITION_SCORE  = 10;

    static final double EMA200_CLEAR_BREAK_PCT = -0.5;
    static final double EMA200_BREAK_PCT       = -0.1;
    static final double EMA200_WELL_ABOVE_PCT  = 1.0;
    static final double EMA200_BREAK_SCORE     = -4;
    static final double EMA200_ABOVE_SCORE     = 4;

    static final double SMART_MONEY_PLAIN     = 5;
    static final double CANDLE_QUALITY_PLAIN  = 4;

    static final double VOLUME_ABOVE_AVG_SCORE = 3;
    static final double VOLUME_WEAK_SCORE      = 2;

    private FactorScorer() {}

    /**
     * Scores all ten factors in display order.
     *
     * @param s sanitized snapshot
     * @return immutable list of exactly ten factors
     */
    public static List<Factor> score(IndicatorSnapshot s) {
        return List.of(
            superTrend(s),
            rsiDualTimeframe(s),
            emaStack(s),
            vwap(s),
            dayChange(s),
            ema200(s),
            parabolicSar(s),
            smartMoney(s),
            candleQuality(s),
            volumeConviction(s)
        );
    }

    // ── 1. SuperTrend ────────────────────────────────────────────────────────

    public static Factor superTrend(IndicatorSnapshot s) {
        IndicatorTrend trend = s.getSuperTrendTrend();
        return Factor.of(SUPERTREND, trend.sign() * SUPERTREND_WEIGHT, SUPERTREND_WEIGHT,
            "SuperTrend " + trend.name().toLowerCase(Locale.ROOT));
    }

    // ── 2. RSI dual timeframe ────────────────────────────────────────────────

    public static Factor rsiDualTimeframe(IndicatorSnapshot s) {
        RsiMomentumStatus status = s.getRsiMomentumStatus();
        if (status.isDecisive()) {
            double value = switch (status) {
                case STRONG     -> RSI_WEIGHT;
                case OVERBOUGHT -> RSI_OVERBOUGHT_SCORE;
                case WEAK       -> -RSI_WEIGHT;
                case OVERSOLD   -> RSI_OVERSOLD_SCORE;
                default         -> 0;
            };
            return Factor.of(RSI_DUAL_TF, value, RSI_WEIGHT, "RSI momentum " + status.name());
        }

        double blended = blendedRsi(s);
        double value = clamp((blended - 50.0) * RSI_BLEND_SLOPE, RSI_WEIGHT);
        return Factor.of(RSI_DUAL_TF, value, RSI_WEIGHT,
            String.format(Locale.ROOT, "RSI 5m %.1f · 15m %.1f", s.getRsi5mRaw(), s.getRsi15mRaw()));
    }

    /**
     * Mean of whichever candle RSIs have left the "no cache" sentinel; the live momentum
     * RSI stands in when neither has.
     */
    static double blendedRsi(IndicatorSnapshot s) {
        boolean has5m  = s.getRsi5mRaw()  != IndicatorSnapshot.RSI_SENTINEL;
        boolean has15m = s.getRsi15mRaw() != IndicatorSnapshot.RSI_SENTINEL;
        if (has5m && has15m) return (s.getRsi5mRaw() + s.getRsi15mRaw()) / 2.0;
        if (has5m)  return s.getRsi5mRaw();
        if (has15m) return s.getRsi15mRaw();
        return s.getRsiLive();
    }

    // ── 3. EMA stack ─────────────────────────────────────────────────────────

    public static Factor emaStack(IndicatorSnapshot s) {
        EmaAlignment alignment = s.getEmaAlignment();
        double value = switch (alignment) {
            case ALL_BULLISH     -> EMA_STACK_WEIGHT;
            case PARTIAL_BULLISH -> EMA_PARTIAL_SCORE;
            case ALL_BEARISH     -> -EMA_STACK_WEIGHT;
            case PARTIAL_BEARISH -> -EMA_PARTIAL_SCORE;
            case NEUTRAL         -> 0;
        };
        return Factor.of(EMA_STACK, value, EMA_STACK_WEIGHT, "EMA stack " + alignment.name());
    }

    // ── 4. VWAP ──────────────────────────────────────────────────────────────

    public static Factor vwap(IndicatorSnapshot s) {
        if (s.getVwap() > 0 && s.getPrice() > 0) {
            double distancePct = percentFrom(s.getPrice(), s.getVwap());
            double value = clamp(Math.round(distancePct * VWAP_POINTS_PER_PCT), VWAP_WEIGHT);
            return Factor.of(VWAP, value, VWAP_WEIGHT,
                String.format(Locale.ROOT, "%+.2f%% vs VWAP", distancePct));
        }
        VwapPosition position = s.getVwapPosition();
        double value = switch (position) {
            case ABOVE_VWAP -> VWAP_POSITION_SCORE;
            case BELOW_VWAP -> -VWAP_POSITION_SCORE;
            case AT_VWAP    -> 0;
        };
        return Factor.of(VWAP, value, VWAP_WEIGHT, position.name());
    }

    // ── 5. Day change ────────────────────────────────────────────────────────

    public static Factor dayChange(IndicatorSnapshot s) {
        double change = s.getChangePercent();
        double value;
        if      (change <= -1.0) value = -12;
        else if (change <= -0.5) value = -9;
        else if (change <= -0.2) value = -5;
        else if (change >=  1.0) value = 12;
        else if (change >=  0.5) value = 9;
        else if (change >=  0.2) value = 5;
        else                     value = change * 4;
        return Factor.of(DAY_CHANGE, value, DAY_CHANGE_WEIGHT,
            String.format(Locale.ROOT, "Day %+.2f%%", change));
    }

    // ── 6. EMA-200 ───────────────────────────────────────────────────────────

    /**
     * Indices spend most sessions just above their 200 EMA, so sitting above it earns
     * nothing; only a confirmed break below, or a clear lead above, moves the score.
     */
    public static Factor ema200(IndicatorSnapshot s) {
        if (s.getEma200() <= 0 || s.getPrice() <= 0) {
            return Factor.of(EMA_200, 0, EMA200_WEIGHT, "EMA-200 unknown");
        }
        double distancePct = percentFrom(s.getPrice(), s.getEma200());
        double value;
        if      (distancePct <= EMA200_CLEAR_BREAK_PCT) value = -EMA200_WEIGHT;
        else if (distancePct <= EMA200_BREAK_PCT)       value = EMA200_BREAK_SCORE;
        else if (distancePct >= EMA200_WELL_ABOVE_PCT)  value = EMA200_ABOVE_SCORE;
        else                                            value = 0;
        return Factor.of(EMA_200, value, EMA200_WEIGHT,
            String.format(Locale.ROOT, "%+.2f%% vs EMA-200", distancePct));
    }

    // ── 7. Parabolic SAR ─────────────────────────────────────────────────────

    public static Factor parabolicSar(IndicatorSnapshot s) {
        IndicatorTrend trend = s.getSarTrend();
        return Factor.of(PARABOLIC_SAR, trend.sign() * SAR_WEIGHT, SAR_WEIGHT,
            "SAR " + trend.name().toLowerCase(Locale.ROOT));
    }

    // ── 8–9. Categorical flow signals ────────────────────────────────────────

    public static Factor smartMoney(IndicatorSnapshot s) {
        FlowSignal signal = s.getSmartMoneySignal();
        return Factor.of(SMART_MONEY, flowScore(signal, SMART_MONEY_WEIGHT, SMART_MONEY_PLAIN),
            SMART_MONEY_WEIGHT, "Smart money " + signal.name());
    }

    public static Factor candleQuality(IndicatorSnapshot s) {
        FlowSignal signal = s.getCandleQualitySignal();
        return Factor.of(CANDLE_QUALITY, flowScore(signal, CANDLE_QUALITY_WEIGHT, CANDLE_QUALITY_PLAIN),
            CANDLE_QUALITY_WEIGHT, "Candle " + signal.name());
    }

    static double flowScore(FlowSignal signal, double strong, double plain) {
        return switch (signal) {
            case STRONG_BUY  -> strong;
            case BUY         -> plain;
            case NEUTRAL     -> 0;
            case SELL        -> -plain;
            case STRONG_SELL -> -strong;
        };
    }

    // ── 10. Volume conviction ────────────────────────────────────────────────

    /**
     * Volume only qualifies the day's move: heavy volume confirms it, weak volume counts
     * against it. With no move there is nothing to confirm.
     */
    public static Factor volumeConviction(IndicatorSnapshot s) {
        String volume = s.getVolumeStrength().toUpperCase(Locale.ROOT);
        double direction = Math.signum(s.getChangePercent());

        double value;
        if (volume.contains("STRONG") || volume.contains("HIGH") || volume.contains("VERY GOOD")) {
            value = direction * VOLUME_WEIGHT;
        } else if (volume.contains("ABOVE")) {
            value = direction * VOLUME_ABOVE_AVG_SCORE;
        } else if (volume.contains("WEAK") || volume.contains("LOW")) {
            value = -direction * VOLUME_WEAK_SCORE;
        } else {
            value = 0;
        }
        // signum(0) * weight yields -0.0 for a flat day; normalize for display
        value = value == 0 ? 0 : value;
        String label = volume.isEmpty() ? "Volume unspecified" : "Volume " + volume;
        return Factor.of(VOLUME, value, VOLUME_WEIGHT, label);
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    static double percentFrom(double price, double reference) {
        return (price - reference) / reference * 100.0;
    }

    static double clamp(double value, double maxAbs) {
        return Math.max(-maxAbs, Math.min(maxAbs, value));
    }
}
