package com.tradesignal.common.prediction;

import com.tradesignal.common.model.Prediction;
import com.tradesignal.common.model.PredictionDirection;
import com.tradesignal.common.model.TrendDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.tradesignal.common.model.TrendDirection.DOWN;
import static com.tradesignal.common.model.TrendDirection.NEUTRAL;
import static com.tradesignal.common.model.TrendDirection.UP;
import static org.junit.jupiter.api.Assertions.*;

class PredictionComposerTest {

    @Test
    @DisplayName("aligned timeframes keep the confidence")
    void alignedNoPenalty() {
        Prediction p = PredictionComposer.composePrediction(UP, UP, 70);
        assertEquals(PredictionDirection.UP, p.direction());
        assertEquals(70, p.confidence());
        assertEquals(PredictionComposer.NOTE_ALIGNED, p.contextNote());
    }

    @Test
    @DisplayName("conflict costs 12 and follows the 5m call")
    void conflictPenalty() {
        Prediction p = PredictionComposer.composePrediction(UP, DOWN, 70);
        assertEquals(PredictionDirection.UP, p.direction());
        assertEquals(58, p.confidence());
        assertTrue(p.contextNote().contains("conflict"));
    }

    @Test
    @DisplayName("one neutral side costs 6")
    void partialPenalty() {
        Prediction only5m = PredictionComposer.composePrediction(DOWN, NEUTRAL, 70);
        assertEquals(PredictionDirection.DOWN, only5m.direction());
        assertEquals(64, only5m.confidence());
        assertEquals(PredictionComposer.NOTE_5M_ONLY, only5m.contextNote());

        Prediction only15m = PredictionComposer.composePrediction(NEUTRAL, UP, 70);
        assertEquals(PredictionDirection.UP, only15m.direction());
        assertEquals(64, only15m.confidence());
        assertEquals(PredictionComposer.NOTE_15M_ONLY, only15m.contextNote());
    }

    @Test
    @DisplayName("both neutral → FLAT, confidence unchanged")
    void bothNeutral() {
        Prediction p = PredictionComposer.composePrediction(NEUTRAL, NEUTRAL, 50);
        assertEquals(PredictionDirection.FLAT, p.direction());
        assertEquals(50, p.confidence());
        assertEquals(PredictionComposer.NOTE_NO_SIGNAL, p.contextNote());
    }

    @Test
    @DisplayName("penalties stop at the 30 floor")
    void floor() {
        assertEquals(30, PredictionComposer.composePrediction(DOWN, UP, 35).confidence());
        assertEquals(30, PredictionComposer.composePrediction(UP, NEUTRAL, 33).confidence());
    }

    @Test
    @DisplayName("agreement classification covers every pair")
    void agreementTable() {
        for (TrendDirection a : TrendDirection.values()) {
            for (TrendDirection b : TrendDirection.values()) {
                PredictionComposer.Agreement agreement = PredictionComposer.Agreement.classify(a, b);
                assertNotNull(agreement);
                assertEquals(agreement == PredictionComposer.Agreement.CONFLICT, a.opposes(b));
            }
        }
    }
}
