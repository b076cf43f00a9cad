package com.patterntrader.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Regime classification as of one date.
 *
 * @param scale            default position-scale multiplier for {@code regime}, in [0, 1]
 * @param movingAverage    long moving average of the index; null when history was too short
 * @param volatilityIndex  last volatility-index reading; null when unavailable
 */
public record RegimeAssessment(
    @JsonProperty("asOf")            LocalDate asOf,
    @JsonProperty("regime")          MarketRegime regime,
    @JsonProperty("scale")           double scale,
    @JsonProperty("trend")           String trend,
    @JsonProperty("volatility")      String volatility,
    @JsonProperty("indexClose")      Double indexClose,
    @JsonProperty("movingAverage")   Double movingAverage,
    @JsonProperty("volatilityIndex") Double volatilityIndex
) {

    public boolean tradingHalted() {
        return scale <= 0.0;
    }
}
