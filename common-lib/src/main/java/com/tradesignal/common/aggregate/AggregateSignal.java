package com.tradesignal.common.aggregate;

import com.tradesignal.common.model.SignalAction;

/**
 * Aggregator output: discrete action, market-adjusted integer confidence, rounded score.
 */
public record AggregateSignal(
    SignalAction action,
    int confidence,
    long totalScore
) {}
