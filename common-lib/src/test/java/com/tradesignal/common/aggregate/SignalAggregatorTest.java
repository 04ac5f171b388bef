package com.tradesignal.common.aggregate;

import com.tradesignal.common.model.Factor;
import com.tradesignal.common.model.MarketStatus;
import com.tradesignal.common.model.SignalAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Threshold boundaries, confidence mapping and the market-status discount.
 */
class SignalAggregatorTest {

    private final SignalAggregator aggregator = new SignalAggregator();

    /** A single wide factor carrying the whole score. */
    private static List<Factor> scoreOf(double total) {
        return List.of(Factor.of("probe", total, 500, "probe"));
    }

    private AggregateSignal live(double total) {
        return aggregator.aggregate(scoreOf(total), MarketStatus.LIVE);
    }

    @Nested
    @DisplayName("action thresholds")
    class Thresholds {

        @Test
        @DisplayName("48 → STRONG_BUY, 47 → BUY")
        void strongBuyBoundary() {
            assertEquals(SignalAction.STRONG_BUY, live(48).action());
            assertEquals(SignalAction.BUY, live(47).action());
        }

        @Test
        @DisplayName("18 → BUY, 17 → SIDEWAYS")
        void buyBoundary() {
            assertEquals(SignalAction.BUY, live(18).action());
            assertEquals(SignalAction.SIDEWAYS, live(17).action());
        }

        @Test
        @DisplayName("9 → SIDEWAYS, 8 → NO_TRADE, 0 → NO_TRADE")
        void noTradeBand() {
            assertEquals(SignalAction.SIDEWAYS, live(9).action());
            assertEquals(SignalAction.NO_TRADE, live(8).action());
            assertEquals(SignalAction.NO_TRADE, live(0).action());
        }

        @Test
        @DisplayName("negative side is symmetric")
        void negativeSide() {
            assertEquals(SignalAction.STRONG_SELL, live(-48).action());
            assertEquals(SignalAction.SELL, live(-47).action());
            assertEquals(SignalAction.SELL, live(-18).action());
            assertEquals(SignalAction.SIDEWAYS, live(-17).action());
            assertEquals(SignalAction.SIDEWAYS, live(-9).action());
            assertEquals(SignalAction.NO_TRADE, live(-8).action());
        }

        @Test
        @DisplayName("score is the rounded sum of all factors")
        void roundedSum() {
            List<Factor> factors = List.of(
                Factor.of("a", 10.5, 20, ""), Factor.of("b", 7.25, 20, ""));
            AggregateSignal signal = aggregator.aggregate(factors, MarketStatus.LIVE);
            assertEquals(18, signal.totalScore());
            assertEquals(SignalAction.BUY, signal.action());
            assertEquals(-17, live(-17.5).totalScore());
        }
    }

    @Nested
    @DisplayName("confidence mapping")
    class Confidence {

        @Test
        void strongBranch() {
            assertEquals(68, live(48).confidence());
            assertEquals(79, live(68).confidence());   // 68 + 20 × 0.54 = 78.8
            assertEquals(95, live(100).confidence());  // capped
        }

        @Test
        void actionBranch() {
            assertEquals(52, live(18).confidence());
            assertEquals(83, live(47).confidence());   // 52 + 29 × 1.07 = 83.03
            assertEquals(63, live(-28).confidence());  // 52 + 10 × 1.07 = 62.7
        }

        @Test
        void neutralBranches() {
            assertEquals(50, live(0).confidence());
            assertEquals(50, live(-8).confidence());
            assertEquals(47, live(9).confidence());    // 42 + 4.5 = 46.5
            assertEquals(51, live(-17).confidence());  // 42 + 8.5 = 50.5
        }
    }

    @Nested
    @DisplayName("market status")
    class MarketStatusPenalty {

        @Test
        @DisplayName("non-LIVE discounts by 15")
        void penaltyApplied() {
            assertEquals(35, aggregator.aggregate(scoreOf(0), MarketStatus.CLOSED).confidence());
            assertEquals(53, aggregator.aggregate(scoreOf(48), MarketStatus.PRE_OPEN).confidence());
            assertEquals(32, aggregator.aggregate(scoreOf(9), MarketStatus.FREEZE).confidence());
        }

        @Test
        @DisplayName("discount never goes below the floor")
        void floorRespected() {
            assertEquals(30, MarketStatusAdjuster.adjust(40, MarketStatus.OFFLINE), 1e-9);
            assertEquals(40, MarketStatusAdjuster.adjust(40, MarketStatus.LIVE), 1e-9);
            assertEquals(30, MarketStatusAdjuster.adjust(40, null), 1e-9);
        }

        @Test
        @DisplayName("LIVE confidence ≥ any non-LIVE confidence for the same factors")
        void monotonic() {
            for (int score = -120; score <= 120; score++) {
                int liveConfidence = live(score).confidence();
                for (MarketStatus status : MarketStatus.values()) {
                    int other = aggregator.aggregate(scoreOf(score), status).confidence();
                    assertTrue(liveConfidence >= other, "score=" + score + " status=" + status);
                    assertTrue(other >= 30 && other <= 95, "score=" + score + " status=" + status);
                }
            }
        }
    }

    @Nested
    @DisplayName("tunable thresholds")
    class Tuning {

        @Test
        @DisplayName("custom thresholds move the action boundaries")
        void customThresholds() {
            SignalThresholds tight = new SignalThresholds(30, 10, 4, 68, 0.54, 95, 52, 1.07, 84, 50, 42, 0.5, 15, 30);
            SignalAggregator custom = new SignalAggregator(tight);
            assertEquals(SignalAction.STRONG_BUY, custom.aggregate(scoreOf(30), MarketStatus.LIVE).action());
            assertEquals(SignalAction.BUY, custom.aggregate(scoreOf(10), MarketStatus.LIVE).action());
            assertEquals(SignalAction.SIDEWAYS, custom.aggregate(scoreOf(5), MarketStatus.LIVE).action());
        }

        @Test
        @DisplayName("inconsistent thresholds are rejected")
        void inconsistentRejected() {
            assertThrows(IllegalArgumentException.class,
                () -> new SignalThresholds(18, 48, 8, 68, 0.54, 95, 52, 1.07, 84, 50, 42, 0.5, 15, 30));
            assertThrows(IllegalArgumentException.class,
                () -> new SignalThresholds(48, 18, 8, 68, 0.54, 95, 52, 1.07, 84, 50, 42, 0.5, 15, 120));
        }
    }
}
