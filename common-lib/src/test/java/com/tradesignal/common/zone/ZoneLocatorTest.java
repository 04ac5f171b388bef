package com.tradesignal.common.zone;

import com.tradesignal.common.model.IndicatorSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ZoneLocatorTest {

    private static ZoneContext locate(double price, double support, double resistance) {
        return ZoneLocator.locate(IndicatorSnapshot.builder()
            .price(price).support(support).resistance(resistance).build());
    }

    @Test
    @DisplayName("within 1.5% above support → NEAR_SUPPORT")
    void nearSupport() {
        ZoneContext z = locate(100, 99, 110);
        assertEquals(MarketZone.NEAR_SUPPORT, z.zone());
        assertEquals(1.0, z.distanceToSupportPct(), 1e-9);
        assertEquals(10.0, z.distanceToResistancePct(), 1e-9);
        assertEquals(100.0 / 11.0, z.positionInRange(), 1e-9);
    }

    @Test
    @DisplayName("within 1.5% below resistance → NEAR_RESISTANCE")
    void nearResistance() {
        assertEquals(MarketZone.NEAR_RESISTANCE, locate(100, 90, 101).zone());
    }

    @Test
    @DisplayName("middle third of the range → MID_RANGE")
    void midRange() {
        ZoneContext z = locate(100, 95, 105);
        assertEquals(MarketZone.MID_RANGE, z.zone());
        assertEquals(50.0, z.positionInRange(), 1e-9);
    }

    @Test
    void inRange() {
        assertEquals(MarketZone.IN_RANGE, locate(100, 98, 110).zone());
    }

    @Test
    @DisplayName("price through a level → OUTSIDE_RANGE")
    void outsideRange() {
        assertEquals(MarketZone.OUTSIDE_RANGE, locate(111, 100, 110).zone());
        assertEquals(MarketZone.OUTSIDE_RANGE, locate(99, 100, 110).zone());
    }

    @Test
    @DisplayName("missing levels or price → UNKNOWN")
    void unknown() {
        assertEquals(ZoneContext.UNKNOWN, locate(100, 0, 0));
        assertEquals(ZoneContext.UNKNOWN, locate(0, 95, 105));
    }

    @Test
    @DisplayName("a single known level still reports its distance")
    void singleLevel() {
        ZoneContext z = locate(100, 0, 101);
        assertEquals(MarketZone.NEAR_RESISTANCE, z.zone());
        assertEquals(50.0, z.positionInRange(), 1e-9);
        assertEquals(0.0, z.distanceToSupportPct(), 1e-9);
    }
}
