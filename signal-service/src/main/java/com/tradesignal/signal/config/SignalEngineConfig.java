package com.tradesignal.signal.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradesignal.common.aggregate.SignalThresholds;
import com.tradesignal.common.engine.SignalEngine;
import com.tradesignal.common.engine.TradeZoneSignalEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SignalEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(SignalEngineConfig.class);

    @Value("${signal.thresholds.strong-score:48}")
    private double strongScore;

    @Value("${signal.thresholds.action-score:18}")
    private double actionScore;

    @Value("${signal.thresholds.no-trade-band:8}")
    private double noTradeBand;

    @Value("${signal.confidence.strong-base:68}")
    private double strongBase;

    @Value("${signal.confidence.strong-slope:0.54}")
    private double strongSlope;

    @Value("${signal.confidence.strong-cap:95}")
    private double strongCap;

    @Value("${signal.confidence.action-base:52}")
    private double actionBase;

    @Value("${signal.confidence.action-slope:1.07}")
    private double actionSlope;

    @Value("${signal.confidence.action-cap:84}")
    private double actionCap;

    @Value("${signal.confidence.no-trade:50}")
    private double noTradeConfidence;

    @Value("${signal.confidence.sideways-base:42}")
    private double sidewaysBase;

    @Value("${signal.confidence.sideways-slope:0.5}")
    private double sidewaysSlope;

    @Value("${signal.confidence.off-market-penalty:15}")
    private double offMarketPenalty;

    @Value("${signal.confidence.floor:30}")
    private double confidenceFloor;

    @Bean
    public SignalThresholds signalThresholds() {
        SignalThresholds thresholds = new SignalThresholds(
            strongScore, actionScore, noTradeBand,
            strongBase, strongSlope, strongCap,
            actionBase, actionSlope, actionCap,
            noTradeConfidence,
            sidewaysBase, sidewaysSlope,
            offMarketPenalty, confidenceFloor);
        if (!thresholds.equals(SignalThresholds.DEFAULTS)) {
            log.warn("Signal thresholds overridden from configuration: {}", thresholds);
        }
        return thresholds;
    }

    @Bean
    public SignalEngine signalEngine(SignalThresholds signalThresholds) {
        return new TradeZoneSignalEngine(signalThresholds);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
