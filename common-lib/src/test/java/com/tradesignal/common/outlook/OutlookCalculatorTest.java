package com.tradesignal.common.outlook;

import com.tradesignal.common.model.MarketStatus;
import com.tradesignal.common.model.Prediction;
import com.tradesignal.common.model.PredictionDirection;
import com.tradesignal.common.model.SignalAction;
import com.tradesignal.common.model.SignalResult;
import com.tradesignal.common.model.TrendDirection;
import com.tradesignal.common.zone.ZoneContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.tradesignal.common.model.SignalAction.*;
import static org.junit.jupiter.api.Assertions.*;

class OutlookCalculatorTest {

    private static SignalResult result(SignalAction action, int confidence) {
        return new SignalResult(action, confidence, 0, List.of(),
            TrendDirection.NEUTRAL, TrendDirection.NEUTRAL,
            new Prediction(PredictionDirection.FLAT, confidence, ""),
            MarketStatus.LIVE, ZoneContext.UNKNOWN);
    }

    private static List<SignalResult> votes(int buys, int sells, int neutrals) {
        List<SignalResult> results = new ArrayList<>();
        for (int i = 0; i < buys; i++)     results.add(result(BUY, 60));
        for (int i = 0; i < sells; i++)    results.add(result(SELL, 60));
        for (int i = 0; i < neutrals; i++) results.add(result(NO_TRADE, 50));
        return results;
    }

    @Nested
    @DisplayName("vote shares")
    class Shares {

        @Test
        @DisplayName("neutral votes count half towards buy")
        void neutralCountsHalf() {
            MarketOutlook o = OutlookCalculator.combine(votes(4, 0, 1));
            assertEquals(90, o.buyPercent());
            assertEquals(10, o.sellPercent());
            assertEquals(STRONG_BUY, o.action());
            assertEquals(5, o.signalCount());
        }

        @Test
        @DisplayName("buy and sell percentages always sum to 100")
        void sharesSumTo100() {
            for (int b = 0; b <= 4; b++) {
                for (int s = 0; s <= 4; s++) {
                    for (int n = 0; n <= 4; n++) {
                        if (b + s + n == 0) continue;
                        MarketOutlook o = OutlookCalculator.combine(votes(b, s, n));
                        assertEquals(100, o.buyPercent() + o.sellPercent());
                        assertTrue(o.buyPercent() >= 0 && o.buyPercent() <= 100);
                    }
                }
            }
        }

        @Test
        @DisplayName("strong and plain variants vote the same way, SIDEWAYS is neutral")
        void actionsAsVotes() {
            MarketOutlook o = OutlookCalculator.combine(List.of(
                result(STRONG_BUY, 90), result(STRONG_SELL, 90), result(SIDEWAYS, 45), result(SIDEWAYS, 45)));
            assertEquals(50, o.buyPercent());
            assertEquals(NO_TRADE, o.action());
        }
    }

    @Nested
    @DisplayName("overall action")
    class Action {

        @Test
        @DisplayName("70% buy is STRONG_BUY, 55% is BUY")
        void buyBoundaries() {
            assertEquals(STRONG_BUY, OutlookCalculator.combine(votes(7, 3, 0)).action());
            assertEquals(BUY, OutlookCalculator.combine(votes(11, 9, 0)).action());
            assertEquals(BUY, OutlookCalculator.combine(votes(3, 2, 0)).action());
        }

        @Test
        @DisplayName("mirror thresholds on the sell side")
        void sellBoundaries() {
            assertEquals(STRONG_SELL, OutlookCalculator.combine(votes(0, 4, 1)).action());
            assertEquals(SELL, OutlookCalculator.combine(votes(1, 2, 2)).action());
            assertEquals(SELL, OutlookCalculator.combine(votes(9, 11, 0)).action());
        }

        @Test
        @DisplayName("a split vote is NO_TRADE")
        void split() {
            MarketOutlook o = OutlookCalculator.combine(votes(1, 1, 3));
            assertEquals(50, o.buyPercent());
            assertEquals(NO_TRADE, o.action());
        }
    }

    @Nested
    @DisplayName("confidence and degenerate inputs")
    class Confidence {

        @Test
        @DisplayName("confidence is the rounded mean, half-up")
        void meanConfidence() {
            assertEquals(70, OutlookCalculator.combine(List.of(
                result(BUY, 80), result(BUY, 70), result(BUY, 60), result(BUY, 90), result(NO_TRADE, 50))).confidence());
            assertEquals(51, OutlookCalculator.combine(List.of(result(BUY, 50), result(BUY, 51))).confidence());
        }

        @Test
        @DisplayName("no signals → 50/50 NO_TRADE at 50")
        void empty() {
            assertEquals(MarketOutlook.EMPTY, OutlookCalculator.combine(Collections.emptyList()));
            assertEquals(MarketOutlook.EMPTY, OutlookCalculator.combine(null));
            assertEquals(MarketOutlook.EMPTY, OutlookCalculator.combine(Arrays.asList(null, null)));
        }

        @Test
        @DisplayName("null entries are skipped")
        void nullsSkipped() {
            MarketOutlook o = OutlookCalculator.combine(Arrays.asList(result(BUY, 80), null, result(BUY, 60)));
            assertEquals(2, o.signalCount());
            assertEquals(100, o.buyPercent());
            assertEquals(70, o.confidence());
        }
    }
}
