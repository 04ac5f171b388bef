package com.tradesignal.signal.card;

import com.tradesignal.common.model.IndicatorSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2)
public class SuperTrendCard implements SignalCard {

    @Override
    public String cardName() { return "SuperTrend"; }

    @Override
    public IndicatorSnapshot project(IndicatorSnapshot full) {
        return SignalCard.priceContext(full)
            .superTrendTrend(full.getSuperTrendTrend())
            .trend5minRaw(full.getTrend5minRaw())
            .build();
    }
}
