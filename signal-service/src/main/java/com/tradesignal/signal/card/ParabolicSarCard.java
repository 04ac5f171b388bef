package com.tradesignal.signal.card;

import com.tradesignal.common.model.IndicatorSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(3)
public class ParabolicSarCard implements SignalCard {

    @Override
    public String cardName() { return "ParabolicSAR"; }

    @Override
    public IndicatorSnapshot project(IndicatorSnapshot full) {
        return SignalCard.priceContext(full)
            .sarTrend(full.getSarTrend())
            .trend15minRaw(full.getTrend15minRaw())
            .build();
    }
}
