package com.tradesignal.signal.controller;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradesignal.signal.mapping.IndicatorPayload;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SignalRequest(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("marketStatus") String marketStatus,   // LIVE / CLOSED / PRE_OPEN / FREEZE / OFFLINE
    @JsonProperty("indicators") IndicatorPayload indicators
) {}
