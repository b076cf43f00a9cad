package com.patterntrader.common.trade;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry, stop and target prices of a planned trade.
 *
 * @param rewardRisk  targetPct / stopLossPct
 */
public record TradeLevels(
    @JsonProperty("entryPrice")  double entryPrice,
    @JsonProperty("stopLoss")    double stopLoss,
    @JsonProperty("target")      double target,
    @JsonProperty("stopLossPct") double stopLossPct,
    @JsonProperty("targetPct")   double targetPct,
    @JsonProperty("rewardRisk")  double rewardRisk
) {}
