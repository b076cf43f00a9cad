package com.patterntrader.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Directional prediction for one pattern in one context. Ephemeral: consumed by sizing
 * and risk, never persisted as-is.
 *
 * @param winRate       primary-horizon win rate of direction-signed returns, 0–100
 * @param profitFactor  primary-horizon gross wins / gross losses
 * @param blend         null until feedback blending touched the prediction
 */
public record Prediction(
    @JsonProperty("pattern")        String pattern,
    @JsonProperty("tier")           RetrievalTier tier,
    @JsonProperty("droppedFields")  List<ContextField> droppedFields,
    @JsonProperty("candidateCount") int candidateCount,
    @JsonProperty("primaryHorizon") int primaryHorizon,
    @JsonProperty("horizons")       Map<Integer, HorizonForecast> horizons,
    @JsonProperty("direction")      Direction direction,
    @JsonProperty("bullishEdge")    double bullishEdge,
    @JsonProperty("bearishEdge")    double bearishEdge,
    @JsonProperty("winRate")        double winRate,
    @JsonProperty("profitFactor")   double profitFactor,
    @JsonProperty("stopLoss")       StopLossMetrics stopLoss,
    @JsonProperty("confidence")     double confidence,
    @JsonProperty("level")          ConfidenceLevel level,
    @JsonProperty("blend")          BlendAudit blend
) {

    public HorizonForecast horizon(int horizon) {
        return horizons.get(horizon);
    }

    public Prediction withBlend(double blendedWinRate, double blendedConfidence,
                                ConfidenceLevel blendedLevel, BlendAudit audit) {
        return new Prediction(pattern, tier, droppedFields, candidateCount, primaryHorizon, horizons,
                              direction, bullishEdge, bearishEdge, blendedWinRate, profitFactor,
                              stopLoss, blendedConfidence, blendedLevel, audit);
    }
}
