package com.tradesignal.signal.mapping;

import com.tradesignal.common.model.EmaAlignment;
import com.tradesignal.common.model.FlowSignal;
import com.tradesignal.common.model.IndicatorSnapshot;
import com.tradesignal.common.model.IndicatorTrend;
import com.tradesignal.common.model.MappedTrend;
import com.tradesignal.common.model.RsiMomentumStatus;
import com.tradesignal.common.model.TrendDirection;
import com.tradesignal.common.model.VwapPosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotMapperTest {

    private final SnapshotMapper mapper = new SnapshotMapper();

    private static IndicatorPayload payload(Double price, Double rsi5m, String status, String ema,
                                            String superTrend, String smartMoney, String trend5) {
        return new IndicatorPayload(price, null, null, rsi5m, null, status, ema,
            null, null, null, superTrend, null, null, null, null, smartMoney, null,
            null, null, null, null, trend5, null);
    }

    @Test
    @DisplayName("null payload maps to the all-neutral snapshot")
    void nullPayload() {
        assertEquals(IndicatorSnapshot.neutral(), mapper.toSnapshot(null));
    }

    @Test
    @DisplayName("omitted numbers take their sentinels")
    void missingNumbers() {
        IndicatorSnapshot s = mapper.toSnapshot(payload(null, null, null, null, null, null, null));

        assertEquals(0.0, s.getPrice());
        assertEquals(IndicatorSnapshot.RSI_SENTINEL, s.getRsiLive());
        assertEquals(IndicatorSnapshot.RSI_SENTINEL, s.getRsi5mRaw());
        assertEquals(IndicatorSnapshot.MOMENTUM_SENTINEL, s.getMomentum());
        assertEquals("", s.getVolumeStrength());
        assertEquals(RsiMomentumStatus.NONE, s.getRsiMomentumStatus());
    }

    @Test
    @DisplayName("labels are matched case-insensitively with '-' and ' ' treated as '_'")
    void labelNormalisation() {
        IndicatorSnapshot s = mapper.toSnapshot(
            payload(250.5, 61.0, "overbought", "Partial-Bullish", "bullish", "strong buy", "up"));

        assertEquals(250.5, s.getPrice());
        assertEquals(61.0, s.getRsi5mRaw());
        assertEquals(RsiMomentumStatus.OVERBOUGHT, s.getRsiMomentumStatus());
        assertEquals(EmaAlignment.PARTIAL_BULLISH, s.getEmaAlignment());
        assertEquals(IndicatorTrend.BULLISH, s.getSuperTrendTrend());
        assertEquals(FlowSignal.STRONG_BUY, s.getSmartMoneySignal());
        assertEquals(TrendDirection.UP, s.getTrend5minRaw());
    }

    @Test
    @DisplayName("unrecognised labels fall back to the neutral constant")
    void unknownLabels() {
        IndicatorSnapshot s = mapper.toSnapshot(
            payload(10.0, null, "SIDEWAYS?", "MIXED", "??", "HOLD", null));

        assertEquals(RsiMomentumStatus.NONE, s.getRsiMomentumStatus());
        assertEquals(EmaAlignment.NEUTRAL, s.getEmaAlignment());
        assertEquals(IndicatorTrend.NEUTRAL, s.getSuperTrendTrend());
        assertEquals(FlowSignal.NEUTRAL, s.getSmartMoneySignal());
        assertEquals(TrendDirection.NEUTRAL, s.getTrend5minRaw());
        assertEquals(VwapPosition.AT_VWAP, s.getVwapPosition());
        assertEquals(MappedTrend.SIDEWAYS, s.getTrendMapped());
    }
}
