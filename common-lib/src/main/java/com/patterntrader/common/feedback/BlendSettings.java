package com.patterntrader.common.feedback;

import com.patterntrader.common.exception.InvalidConfigurationException;

import java.util.List;
import java.util.Map;

/**
 * Constants of feedback blending. {@code cascade} is walked in order and the first
 * category whose record has at least {@code minTrades.get(category)} trades is used.
 */
public record BlendSettings(
    List<AdjustmentCategory> cascade,
    Map<AdjustmentCategory, Integer> minTrades,
    double weightCap,
    double weightPrior,
    double ruleScaleSlope,
    double ruleScaleCap,
    double trendAlignedBoost,
    double trendAgainstPenalty,
    double volumeConfirmationBoost,
    double perPatternVolumeBoost,
    double stopLossTuningPenalty,
    double volumeEdgeThreshold,
    double volumeEdgeFactor
) {

    public static BlendSettings defaults() {
        return new BlendSettings(
            List.of(AdjustmentCategory.TRIPLE, AdjustmentCategory.HORIZON, AdjustmentCategory.SECTOR,
                    AdjustmentCategory.REGIME, AdjustmentCategory.PATTERN),
            Map.of(AdjustmentCategory.TRIPLE, 3, AdjustmentCategory.HORIZON, 2, AdjustmentCategory.SECTOR, 2,
                   AdjustmentCategory.REGIME, 3, AdjustmentCategory.PATTERN, 2),
            0.50, 20.0,
            2.5, 3.0,
            0.05, 0.04, 0.03, 0.04, 0.04,
            0.10, 0.15);
    }

    /** {@code min(weightCap, n / (n + weightPrior))}; non-decreasing in n. */
    public double weightFor(int sampleCount) {
        if (sampleCount <= 0) return 0.0;
        return Math.min(weightCap, sampleCount / (sampleCount + weightPrior));
    }

    public BlendSettings validate() {
        if (cascade == null || cascade.isEmpty())
            throw new InvalidConfigurationException("BlendSettings", "cascade must not be empty");
        if (minTrades == null || !minTrades.keySet().containsAll(cascade))
            throw new InvalidConfigurationException("BlendSettings", "minTrades needs a value for every cascade category");
        if (minTrades.values().stream().anyMatch(v -> v < 1))
            throw new InvalidConfigurationException("BlendSettings", "minTrades must be >= 1");
        if (weightCap <= 0 || weightCap > 1)
            throw new InvalidConfigurationException("BlendSettings", "weightCap must be in (0,1], got " + weightCap);
        if (weightPrior <= 0)
            throw new InvalidConfigurationException("BlendSettings", "weightPrior must be positive");
        if (ruleScaleSlope < 0 || ruleScaleCap < 1)
            throw new InvalidConfigurationException("BlendSettings", "rule scale must satisfy slope >= 0 and cap >= 1");
        return this;
    }
}
