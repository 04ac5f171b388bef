package com.tradesignal.signal.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradesignal.common.outlook.MarketOutlook;

import java.util.List;

/** Every card's signal for one symbol plus their combined outlook. */
public record SymbolOutlook(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("cards") List<CardSignal> cards,
    @JsonProperty("outlook") MarketOutlook outlook
) {}
