package com.patterntrader.common.prediction;

import com.patterntrader.common.model.ConfidenceLevel;
import com.patterntrader.common.model.RetrievalTier;

/**
 * Calibrated confidence of a prediction.
 *
 * <pre>
 *   confidence = edgeStrength       × 0.30   (max |edge| / 100)
 *              + sampleAdequacy     × 0.20   (min(1, n / 30))
 *              + tierQuality        × 0.25   (T1 1.0, T2 0.8, T3 0.5, T4 0.3)
 *              + profitFactorFactor × 0.25   (clamp((pf - 0.5) / 1.5, 0, 1))
 * </pre>
 *
 * Weights and thresholds come from {@link PredictorSettings}; the result is always in [0, 1].
 */
public final class ConfidenceScorer {

    private ConfidenceScorer() {}

    public static double score(double bullishEdge, double bearishEdge, int sampleSize,
                               RetrievalTier tier, double profitFactor, PredictorSettings settings) {
        double edgeStrength   = Math.min(1.0, Math.max(Math.abs(bullishEdge), Math.abs(bearishEdge)) / 100.0);
        double sampleAdequacy = Math.min(1.0, (double) sampleSize / settings.sampleSaturation());
        double tierQuality    = settings.qualityOf(tier);
        double pfFactor       = Math.min(1.0, Math.max(0.0, (profitFactor - 0.5) / 1.5));

        double confidence = edgeStrength   * settings.edgeWeight()
                          + sampleAdequacy * settings.sampleWeight()
                          + tierQuality    * settings.tierWeight()
                          + pfFactor       * settings.profitFactorWeight();
        return clamp01(confidence);
    }

    public static ConfidenceLevel level(double confidence, PredictorSettings settings) {
        if (confidence > settings.highThreshold())   return ConfidenceLevel.HIGH;
        if (confidence > settings.mediumThreshold()) return ConfidenceLevel.MEDIUM;
        return ConfidenceLevel.LOW;
    }

    public static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
