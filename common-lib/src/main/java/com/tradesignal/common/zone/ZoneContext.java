package com.tradesignal.common.zone;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Support/resistance context shown next to a signal. Informational; it never changes the
 * action or the confidence.
 *
 * @param distanceToSupportPct    (price − support) / price × 100, 0 when support is unknown
 * @param distanceToResistancePct (resistance − price) / price × 100, 0 when resistance is unknown
 * @param positionInRange         0 at support, 100 at resistance, 50 when the range is unknown
 */
public record ZoneContext(
    @JsonProperty("distanceToSupportPct") double distanceToSupportPct,
    @JsonProperty("distanceToResistancePct") double distanceToResistancePct,
    @JsonProperty("positionInRange") double positionInRange,
    @JsonProperty("zone") MarketZone zone
) {
    public static final ZoneContext UNKNOWN = new ZoneContext(0, 0, 50, MarketZone.UNKNOWN);
}
