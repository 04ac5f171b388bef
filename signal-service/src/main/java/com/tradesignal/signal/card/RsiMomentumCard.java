package com.tradesignal.signal.card;

import com.tradesignal.common.model.IndicatorSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** RSI 60/40 momentum card: live and candle RSIs, momentum status and score. */
@Component
@Order(4)
public class RsiMomentumCard implements SignalCard {

    @Override
    public String cardName() { return "RsiMomentum"; }

    @Override
    public IndicatorSnapshot project(IndicatorSnapshot full) {
        return SignalCard.priceContext(full)
            .rsiLive(full.getRsiLive())
            .rsi5mRaw(full.getRsi5mRaw())
            .rsi15mRaw(full.getRsi15mRaw())
            .rsiMomentumStatus(full.getRsiMomentumStatus())
            .momentum(full.getMomentum())
            .build();
    }
}
