package com.tradesignal.signal.mapping;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The {@code indicators} object of the market-data backend, field for field.
 *
 * <p>Everything is boxed or a raw string: the backend omits fields freely and its enum
 * labels are not guaranteed to be clean. {@link SnapshotMapper} turns this into a
 * sentinel-filled {@link com.tradesignal.common.model.IndicatorSnapshot}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndicatorPayload(
    @JsonProperty("price") Double price,
    @JsonProperty("change_percent") Double changePercent,
    @JsonProperty("rsi") Double rsi,
    @JsonProperty("rsi_5m") Double rsi5m,
    @JsonProperty("rsi_15m") Double rsi15m,
    @JsonProperty("rsi_momentum_status") String rsiMomentumStatus,
    @JsonProperty("ema_alignment") String emaAlignment,
    @JsonProperty("vwap") Double vwap,
    @JsonProperty("vwap_position") String vwapPosition,
    @JsonProperty("ema_200") Double ema200,
    @JsonProperty("supertrend_trend") String superTrendTrend,
    @JsonProperty("sar_trend") String sarTrend,
    @JsonProperty("trend_structure") String trendStructure,
    @JsonProperty("trend_color") String trendColor,
    @JsonProperty("trend") String trend,
    @JsonProperty("smart_money_signal") String smartMoneySignal,
    @JsonProperty("candle_quality_signal") String candleQualitySignal,
    @JsonProperty("volume_strength") String volumeStrength,
    @JsonProperty("support") Double support,
    @JsonProperty("resistance") Double resistance,
    @JsonProperty("momentum") Double momentum,
    @JsonProperty("trend_5min") String trend5min,
    @JsonProperty("trend_15min") String trend15min
) {}
