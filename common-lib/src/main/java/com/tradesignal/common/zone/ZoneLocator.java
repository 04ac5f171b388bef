package com.tradesignal.common.zone;

import com.tradesignal.common.model.IndicatorSnapshot;

/**
 * Pure stateless locator of the trade zone around the current price.
 *
 * <pre>
 *   levels missing                          → UNKNOWN
 *   price below support / above resistance  → OUTSIDE_RANGE
 *   within 1.5% above support               → NEAR_SUPPORT
 *   within 1.5% below resistance            → NEAR_RESISTANCE
 *   35 &lt; positionInRange &lt; 65             → MID_RANGE
 *   otherwise                               → IN_RANGE
 * </pre>
 * Support is checked before resistance when a narrow range puts price near both.
 */
public final class ZoneLocator {

    static final double NEAR_LEVEL_PCT = 1.5;
    static final double MID_LOW        = 35;
    static final double MID_HIGH       = 65;

    private ZoneLocator() {}

    public static ZoneContext locate(IndicatorSnapshot s) {
        double price = s.getPrice();
        double support = s.getSupport();
        double resistance = s.getResistance();
        if (price <= 0 || (support <= 0 && resistance <= 0)) return ZoneContext.UNKNOWN;

        double toSupport    = support > 0    ? (price - support) / price * 100.0 : 0.0;
        double toResistance = resistance > 0 ? (resistance - price) / price * 100.0 : 0.0;
        double range = resistance - support;
        double position = (support > 0 && resistance > 0 && range > 0)
            ? (price - support) / range * 100.0
            : 50.0;

        MarketZone zone;
        if ((support > 0 && price < support) || (resistance > 0 && price > resistance)) {
            zone = MarketZone.OUTSIDE_RANGE;
        } else if (support > 0 && toSupport <= NEAR_LEVEL_PCT) {
            zone = MarketZone.NEAR_SUPPORT;
        } else if (resistance > 0 && toResistance <= NEAR_LEVEL_PCT) {
            zone = MarketZone.NEAR_RESISTANCE;
        } else if (support > 0 && resistance > 0 && position > MID_LOW && position < MID_HIGH) {
            zone = MarketZone.MID_RANGE;
        } else {
            zone = MarketZone.IN_RANGE;
        }
        return new ZoneContext(toSupport, toResistance, position, zone);
    }
}
