package com.tradesignal.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradesignal.common.zone.ZoneContext;

import java.util.List;

/**
 * Complete output of one engine evaluation. Derived fresh from every snapshot; nothing in
 * here is carried over between evaluations.
 */
public record SignalResult(
    @JsonProperty("action") SignalAction action,
    @JsonProperty("confidence") int confidence,
    @JsonProperty("totalScore") long totalScore,
    @JsonProperty("factors") List<Factor> factors,
    @JsonProperty("trend5min") TrendDirection trend5min,
    @JsonProperty("trend15min") TrendDirection trend15min,
    @JsonProperty("prediction") Prediction prediction,
    @JsonProperty("marketStatus") MarketStatus marketStatus,
    @JsonProperty("zone") ZoneContext zone
) {
    public SignalResult {
        factors = List.copyOf(factors);
    }
}
