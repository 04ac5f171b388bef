package com.tradesignal.signal.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradesignal.common.model.Prediction;
import com.tradesignal.common.model.SignalAction;
import com.tradesignal.common.model.SignalResult;

public record CardSignal(
    @JsonProperty("card") String card,
    @JsonProperty("action") SignalAction action,
    @JsonProperty("confidence") int confidence,
    @JsonProperty("totalScore") long totalScore,
    @JsonProperty("prediction") Prediction prediction
) {
    public static CardSignal of(String card, SignalResult result) {
        return new CardSignal(card, result.action(), result.confidence(),
            result.totalScore(), result.prediction());
    }
}
