package com.patterntrader.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of fractional-Kelly sizing. Percentages are of capital.
 *
 * @param kellyRawPct    fractional Kelly clamped to the maximum position size, before the
 *                       confidence, horizon, sector and regime multipliers, in percent
 * @param positionPct    final size; 0 means no trade
 * @param riskPerTrade   capital lost if the stop-loss is hit
 * @param reasoning      one-line trace of every factor, for logs
 */
public record PositionSizingDecision(
    @JsonProperty("kellyRawPct")          double kellyRawPct,
    @JsonProperty("positionPct")          double positionPct,
    @JsonProperty("positionValue")        double positionValue,
    @JsonProperty("confidenceMultiplier") double confidenceMultiplier,
    @JsonProperty("horizonMultiplier")    double horizonMultiplier,
    @JsonProperty("sectorMultiplier")     double sectorMultiplier,
    @JsonProperty("regimeScale")          double regimeScale,
    @JsonProperty("riskPerTrade")         double riskPerTrade,
    @JsonProperty("riskPctCapital")       double riskPctCapital,
    @JsonProperty("avgWinEstimate")       double avgWinEstimate,
    @JsonProperty("avgLossEstimate")      double avgLossEstimate,
    @JsonProperty("reasoning")            String reasoning
) {

    public boolean isTradable() {
        return positionPct > 0.0;
    }
}
