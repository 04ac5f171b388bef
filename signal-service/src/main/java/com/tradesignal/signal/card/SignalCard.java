package com.tradesignal.signal.card;

import com.tradesignal.common.model.IndicatorSnapshot;

/**
 * A dashboard card that shows a signal derived from its own subset of indicators.
 *
 * <p>Cards do not score anything themselves: each one projects the full snapshot onto the
 * indicators it displays (everything else reset to its sentinel) and the shared
 * {@link com.tradesignal.common.engine.SignalEngine} does the rest.
 */
public interface SignalCard {

    String cardName();

    IndicatorSnapshot project(IndicatorSnapshot full);

    /** Price context every card keeps: price, day change and volume. */
    static IndicatorSnapshot.IndicatorSnapshotBuilder priceContext(IndicatorSnapshot full) {
        return IndicatorSnapshot.builder()
            .price(full.getPrice())
            .changePercent(full.getChangePercent())
            .volumeStrength(full.getVolumeStrength())
            .support(full.getSupport())
            .resistance(full.getResistance());
    }
}
