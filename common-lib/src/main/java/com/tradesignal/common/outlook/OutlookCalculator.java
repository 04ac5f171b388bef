package com.tradesignal.common.outlook;

import com.tradesignal.common.model.SignalAction;
import com.tradesignal.common.model.SignalResult;

import java.util.List;

/**
 * Reduces the per-card signals of one symbol to a single {@link MarketOutlook}.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Each signal is one vote: BUY / STRONG_BUY for buy, SELL / STRONG_SELL for sell,
 *       anything else neutral.</li>
 *   <li>{@code buyPercent = round((buys + neutrals / 2) / votes × 100)},
 *       {@code sellPercent = 100 − buyPercent}.</li>
 *   <li>Confidence is the rounded mean of the signals' confidences.</li>
 *   <li>Action, first match wins: buy ≥ 70 STRONG_BUY, buy ≥ 55 BUY, sell ≥ 70 STRONG_SELL,
 *       sell ≥ 55 SELL, else NO_TRADE.</li>
 * </ol>
 *
 * <p>Null entries are skipped; no signals yields {@link MarketOutlook#EMPTY}.
 */
public final class OutlookCalculator {

    static final int STRONG_SHARE = 70;
    static final int ACTION_SHARE = 55;

    private OutlookCalculator() {}

    public static MarketOutlook combine(List<SignalResult> results) {
        if (results == null) return MarketOutlook.EMPTY;

        int buys = 0;
        int sells = 0;
        int neutrals = 0;
        long confidenceSum = 0;
        for (SignalResult result : results) {
            if (result == null) continue;
            SignalAction action = result.action();
            if (action.isBuy())       buys++;
            else if (action.isSell()) sells++;
            else                      neutrals++;
            confidenceSum += result.confidence();
        }

        int votes = buys + sells + neutrals;
        if (votes == 0) return MarketOutlook.EMPTY;

        int buyPercent  = (int) Math.round((buys + neutrals * 0.5) / votes * 100.0);
        int sellPercent = 100 - buyPercent;
        int confidence  = (int) Math.round((double) confidenceSum / votes);
        return new MarketOutlook(buyPercent, sellPercent, confidence, classify(buyPercent, sellPercent), votes);
    }

    static SignalAction classify(int buyPercent, int sellPercent) {
        if (buyPercent  >= STRONG_SHARE) return SignalAction.STRONG_BUY;
        if (buyPercent  >= ACTION_SHARE) return SignalAction.BUY;
        if (sellPercent >= STRONG_SHARE) return SignalAction.STRONG_SELL;
        if (sellPercent >= ACTION_SHARE) return SignalAction.SELL;
        return SignalAction.NO_TRADE;
    }
}
