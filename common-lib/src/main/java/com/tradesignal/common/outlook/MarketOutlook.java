package com.tradesignal.common.outlook;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradesignal.common.model.SignalAction;

/**
 * Combined verdict over several card signals for one symbol.
 *
 * @param buyPercent  share of buy votes, neutral votes counting half; 0..100
 * @param sellPercent {@code 100 - buyPercent}
 * @param confidence  mean confidence of the combined signals
 * @param action      STRONG_BUY, BUY, NO_TRADE, SELL or STRONG_SELL
 * @param signalCount number of signals combined
 */
public record MarketOutlook(
    @JsonProperty("buyPercent") int buyPercent,
    @JsonProperty("sellPercent") int sellPercent,
    @JsonProperty("confidence") int confidence,
    @JsonProperty("action") SignalAction action,
    @JsonProperty("signalCount") int signalCount
) {
    public static final MarketOutlook EMPTY = new MarketOutlook(50, 50, 50, SignalAction.NO_TRADE, 0);
}
