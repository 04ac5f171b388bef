package com.tradesignal.common.snapshot;

import com.tradesignal.common.model.EmaAlignment;
import com.tradesignal.common.model.FlowSignal;
import com.tradesignal.common.model.IndicatorSnapshot;
import com.tradesignal.common.model.IndicatorTrend;
import com.tradesignal.common.model.MappedTrend;
import com.tradesignal.common.model.RsiMomentumStatus;
import com.tradesignal.common.model.TrendDirection;
import com.tradesignal.common.model.TrendStructure;
import com.tradesignal.common.model.VwapPosition;

/**
 * Pure stateless normalizer applied before any scoring.
 *
 * <p>Replaces NaN / ±Infinity with the field's neutral sentinel and {@code null} enums or
 * strings with their NEUTRAL / empty value, so no invalid number can leak into the factor sum.
 * The snapshot is returned unchanged when it is already clean.
 */
public final class SnapshotSanitizer {

    private SnapshotSanitizer() {}

    public static IndicatorSnapshot sanitize(IndicatorSnapshot s) {
        if (s == null) return IndicatorSnapshot.neutral();
        if (isClean(s)) return s;

        double rsi = IndicatorSnapshot.RSI_SENTINEL;
        return s.toBuilder()
            .price(finiteOr(s.getPrice(), 0.0))
            .changePercent(finiteOr(s.getChangePercent(), 0.0))
            .rsiLive(finiteOr(s.getRsiLive(), rsi))
            .rsi5mRaw(finiteOr(s.getRsi5mRaw(), rsi))
            .rsi15mRaw(finiteOr(s.getRsi15mRaw(), rsi))
            .rsiMomentumStatus(orDefault(s.getRsiMomentumStatus(), RsiMomentumStatus.NONE))
            .emaAlignment(orDefault(s.getEmaAlignment(), EmaAlignment.NEUTRAL))
            .vwap(finiteOr(s.getVwap(), 0.0))
            .vwapPosition(orDefault(s.getVwapPosition(), VwapPosition.AT_VWAP))
            .ema200(finiteOr(s.getEma200(), 0.0))
            .superTrendTrend(orDefault(s.getSuperTrendTrend(), IndicatorTrend.NEUTRAL))
            .sarTrend(orDefault(s.getSarTrend(), IndicatorTrend.NEUTRAL))
            .trendStructure(orDefault(s.getTrendStructure(), TrendStructure.SIDEWAYS))
            .trendColor(orDefault(s.getTrendColor(), IndicatorTrend.NEUTRAL))
            .trendMapped(orDefault(s.getTrendMapped(), MappedTrend.SIDEWAYS))
            .smartMoneySignal(orDefault(s.getSmartMoneySignal(), FlowSignal.NEUTRAL))
            .candleQualitySignal(orDefault(s.getCandleQualitySignal(), FlowSignal.NEUTRAL))
            .volumeStrength(orDefault(s.getVolumeStrength(), ""))
            .support(finiteOr(s.getSupport(), 0.0))
            .resistance(finiteOr(s.getResistance(), 0.0))
            .momentum(finiteOr(s.getMomentum(), IndicatorSnapshot.MOMENTUM_SENTINEL))
            .trend5minRaw(orDefault(s.getTrend5minRaw(), TrendDirection.NEUTRAL))
            .trend15minRaw(orDefault(s.getTrend15minRaw(), TrendDirection.NEUTRAL))
            .build();
    }

    static boolean isClean(IndicatorSnapshot s) {
        return allFinite(s.getPrice(), s.getChangePercent(), s.getRsiLive(), s.getRsi5mRaw(),
                         s.getRsi15mRaw(), s.getVwap(), s.getEma200(), s.getSupport(),
                         s.getResistance(), s.getMomentum())
            && noneNull(s.getRsiMomentumStatus(), s.getEmaAlignment(), s.getVwapPosition(),
                        s.getSuperTrendTrend(), s.getSarTrend(), s.getTrendStructure(),
                        s.getTrendColor(), s.getTrendMapped(), s.getSmartMoneySignal(),
                        s.getCandleQualitySignal(), s.getVolumeStrength(),
                        s.getTrend5minRaw(), s.getTrend15minRaw());
    }

    /** {@code value} when it is a finite number, otherwise {@code sentinel}. */
    public static double finiteOr(double value, double sentinel) {
        return Double.isFinite(value) ? value : sentinel;
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static boolean allFinite(double... values) {
        for (double v : values) {
            if (!Double.isFinite(v)) return false;
        }
        return true;
    }

    private static boolean noneNull(Object... values) {
        for (Object v : values) {
            if (v == null) return false;
        }
        return true;
    }
}
