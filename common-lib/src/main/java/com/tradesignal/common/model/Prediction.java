package com.tradesignal.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Short-horizon (5-minute) forecast reconciling the 5m and 15m calls.
 * {@code contextNote} is display text only.
 */
public record Prediction(
    @JsonProperty("direction") PredictionDirection direction,
    @JsonProperty("confidence") int confidence,
    @JsonProperty("contextNote") String contextNote
) {}
