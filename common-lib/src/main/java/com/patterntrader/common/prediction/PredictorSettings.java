package com.patterntrader.common.prediction;

import com.patterntrader.common.exception.InvalidConfigurationException;
import com.patterntrader.common.model.RetrievalTier;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Retrieval and calibration constants of the tiered predictor.
 *
 * <p>{@link #defaults()} reproduces the historically tuned values; services bind overrides
 * from configuration and must call {@link #validate()} before use.
 */
public record PredictorSettings(
    int minMatches,
    int topK,
    int maxPerInstrument,
    int maxPerSector,
    int minIndices,
    List<Integer> horizons,
    int primaryHorizon,
    double edgeThreshold,
    Set<RetrievalTier> allowedTiers,
    Map<RetrievalTier, Double> tierQuality,
    double edgeWeight,
    double sampleWeight,
    double tierWeight,
    double profitFactorWeight,
    int sampleSaturation,
    double highThreshold,
    double mediumThreshold,
    PatternFilter patternFilter,
    StopLossSettings stopLoss
) {

    public static PredictorSettings defaults() {
        return new PredictorSettings(
            5, 50, 5, 15, 3,
            List.of(1, 3, 5, 10, 25), 5,
            3.0,
            EnumSet.of(RetrievalTier.TIER_1, RetrievalTier.TIER_2),
            Map.of(RetrievalTier.TIER_1, 1.0, RetrievalTier.TIER_2, 0.8,
                   RetrievalTier.TIER_3, 0.5, RetrievalTier.TIER_4, 0.3),
            0.30, 0.20, 0.25, 0.25,
            30,
            0.55, 0.35,
            PatternFilter.defaults(),
            StopLossSettings.defaults());
    }

    public double qualityOf(RetrievalTier tier) {
        return tierQuality.getOrDefault(tier, 0.0);
    }

    public PredictorSettings validate() {
        require(minMatches > 0, "minMatches must be positive");
        require(topK >= minMatches, "topK must be >= minMatches");
        require(maxPerInstrument > 0, "maxPerInstrument must be positive");
        require(maxPerSector >= maxPerInstrument, "maxPerSector must be >= maxPerInstrument");
        require(minIndices > 0, "minIndices must be positive");
        require(horizons != null && !horizons.isEmpty(), "horizons must not be empty");
        require(horizons.stream().allMatch(h -> h > 0), "horizons must be positive");
        require(horizons.contains(primaryHorizon), "primaryHorizon must be one of horizons");
        require(edgeThreshold >= 0, "edgeThreshold must be >= 0");
        require(allowedTiers != null && !allowedTiers.isEmpty(), "allowedTiers must not be empty");
        require(tierQuality != null && tierQuality.values().stream().allMatch(q -> q >= 0 && q <= 1),
                "tierQuality weights must be in [0,1]");
        double weights = edgeWeight + sampleWeight + tierWeight + profitFactorWeight;
        require(edgeWeight >= 0 && sampleWeight >= 0 && tierWeight >= 0 && profitFactorWeight >= 0,
                "confidence weights must be >= 0");
        require(Math.abs(weights - 1.0) < 1e-9, "confidence weights must sum to 1.0, got " + weights);
        require(sampleSaturation > 0, "sampleSaturation must be positive");
        require(mediumThreshold >= 0 && highThreshold <= 1 && mediumThreshold < highThreshold,
                "confidence thresholds must satisfy 0 <= medium < high <= 1");
        require(patternFilter != null, "patternFilter must be set");
        require(stopLoss != null, "stopLoss must be set");
        stopLoss.validate();
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) throw new InvalidConfigurationException("PredictorSettings", message);
    }
}
