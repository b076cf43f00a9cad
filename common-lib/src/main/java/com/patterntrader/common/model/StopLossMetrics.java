package com.patterntrader.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Primary-horizon performance when an ATR stop-loss is applied to each candidate.
 *
 * @param stopLossPct      stop distance in percent of price
 * @param winRate          win rate after stop-outs, 0–100
 * @param profitFactor     gross wins / gross losses after stop-outs
 * @param triggeredPct     share of trades whose adverse excursion breached the stop
 * @param avgMfe           mean max favorable excursion
 * @param avgMae           mean max adverse excursion
 * @param rewardRiskRatio  |avgMfe / avgMae|
 */
public record StopLossMetrics(
    @JsonProperty("stopLossPct")     double stopLossPct,
    @JsonProperty("winRate")         double winRate,
    @JsonProperty("profitFactor")    double profitFactor,
    @JsonProperty("triggeredPct")    double triggeredPct,
    @JsonProperty("avgMfe")          double avgMfe,
    @JsonProperty("avgMae")          double avgMae,
    @JsonProperty("rewardRiskRatio") double rewardRiskRatio
) {}
