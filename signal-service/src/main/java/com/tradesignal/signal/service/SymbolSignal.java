package com.tradesignal.signal.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradesignal.common.model.SignalResult;

import java.time.Instant;

/**
 * Engine result for one symbol. {@code degraded} is set when evaluation failed and the
 * neutral fallback was returned instead.
 */
public record SymbolSignal(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("result") SignalResult result,
    @JsonProperty("degraded") boolean degraded,
    @JsonProperty("evaluatedAt") Instant evaluatedAt
) {}
