package com.tradesignal.signal.mapping;

import com.tradesignal.common.model.EmaAlignment;
import com.tradesignal.common.model.FlowSignal;
import com.tradesignal.common.model.IndicatorSnapshot;
import com.tradesignal.common.model.IndicatorTrend;
import com.tradesignal.common.model.MappedTrend;
import com.tradesignal.common.model.RsiMomentumStatus;
import com.tradesignal.common.model.TrendDirection;
import com.tradesignal.common.model.TrendStructure;
import com.tradesignal.common.model.VwapPosition;
import com.tradesignal.common.snapshot.SnapshotSanitizer;
import org.springframework.stereotype.Component;

/**
 * Maps a backend {@link IndicatorPayload} onto the engine's {@link IndicatorSnapshot}.
 * Missing numbers take the field's sentinel, unknown labels their neutral constant.
 */
@Component
public class SnapshotMapper {

    public IndicatorSnapshot toSnapshot(IndicatorPayload p) {
        if (p == null) return IndicatorSnapshot.neutral();

        double rsi = IndicatorSnapshot.RSI_SENTINEL;
        IndicatorSnapshot snapshot = IndicatorSnapshot.builder()
            .price(orElse(p.price(), 0.0))
            .changePercent(orElse(p.changePercent(), 0.0))
            .rsiLive(orElse(p.rsi(), rsi))
            .rsi5mRaw(orElse(p.rsi5m(), rsi))
            .rsi15mRaw(orElse(p.rsi15m(), rsi))
            .rsiMomentumStatus(RsiMomentumStatus.from(p.rsiMomentumStatus()))
            .emaAlignment(EmaAlignment.from(p.emaAlignment()))
            .vwap(orElse(p.vwap(), 0.0))
            .vwapPosition(VwapPosition.from(p.vwapPosition()))
            .ema200(orElse(p.ema200(), 0.0))
            .superTrendTrend(IndicatorTrend.from(p.superTrendTrend()))
            .sarTrend(IndicatorTrend.from(p.sarTrend()))
            .trendStructure(TrendStructure.from(p.trendStructure()))
            .trendColor(IndicatorTrend.from(p.trendColor()))
            .trendMapped(MappedTrend.from(p.trend()))
            .smartMoneySignal(FlowSignal.from(p.smartMoneySignal()))
            .candleQualitySignal(FlowSignal.from(p.candleQualitySignal()))
            .volumeStrength(p.volumeStrength() != null ? p.volumeStrength() : "")
            .support(orElse(p.support(), 0.0))
            .resistance(orElse(p.resistance(), 0.0))
            .momentum(orElse(p.momentum(), IndicatorSnapshot.MOMENTUM_SENTINEL))
            .trend5minRaw(TrendDirection.from(p.trend5min()))
            .trend15minRaw(TrendDirection.from(p.trend15min()))
            .build();
        return SnapshotSanitizer.sanitize(snapshot);
    }

    private static double orElse(Double value, double sentinel) {
        return value != null ? value : sentinel;
    }
}
