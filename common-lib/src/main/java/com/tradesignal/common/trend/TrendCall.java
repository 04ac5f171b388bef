package com.tradesignal.common.trend;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradesignal.common.model.TrendDirection;

/**
 * A timeframe call together with the fallback-chain link that decided it.
 */
public record TrendCall(
    @JsonProperty("direction") TrendDirection direction,
    @JsonProperty("source") TrendSource source
) {
    static final TrendCall UNDECIDED = new TrendCall(TrendDirection.NEUTRAL, TrendSource.NONE);

    static TrendCall of(TrendDirection direction, TrendSource source) {
        return direction.isDirectional() ? new TrendCall(direction, source) : UNDECIDED;
    }
}
