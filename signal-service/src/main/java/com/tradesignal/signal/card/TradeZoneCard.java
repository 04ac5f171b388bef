package com.tradesignal.signal.card;

import com.tradesignal.common.model.IndicatorSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** The full ten-factor view: every indicator participates. */
@Component
@Order(1)
public class TradeZoneCard implements SignalCard {

    @Override
    public String cardName() { return "TradeZones"; }

    @Override
    public IndicatorSnapshot project(IndicatorSnapshot full) {
        return full;
    }
}
