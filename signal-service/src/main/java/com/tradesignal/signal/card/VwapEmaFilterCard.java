package com.tradesignal.signal.card;

import com.tradesignal.common.model.IndicatorSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** VWAP / EMA filter card: VWAP distance, EMA stack and the 200 EMA. */
@Component
@Order(5)
public class VwapEmaFilterCard implements SignalCard {

    @Override
    public String cardName() { return "VwapEmaFilter"; }

    @Override
    public IndicatorSnapshot project(IndicatorSnapshot full) {
        return SignalCard.priceContext(full)
            .vwap(full.getVwap())
            .vwapPosition(full.getVwapPosition())
            .emaAlignment(full.getEmaAlignment())
            .ema200(full.getEma200())
            .build();
    }
}
