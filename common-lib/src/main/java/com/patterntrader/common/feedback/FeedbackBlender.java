package com.patterntrader.common.feedback;

import com.patterntrader.common.model.BlendAudit;
import com.patterntrader.common.model.ConfidenceLevel;
import com.patterntrader.common.model.Direction;
import com.patterntrader.common.model.HorizonForecast;
import com.patterntrader.common.model.Prediction;
import com.patterntrader.common.prediction.ConfidenceScorer;
import com.patterntrader.common.prediction.PredictorSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Blends realized paper-trading outcomes back into a raw prediction.
 *
 * <h3>Win rate</h3>
 * The most specific adjustment record with enough trades is chosen by walking the cascade
 * (pattern+trend+horizon → pattern+horizon → pattern+sector → pattern+trend → pattern), then
 * <pre>
 *   w       = min(0.50, n / (n + 20))
 *   blended = raw × (1 − w) + paperWinRate × w
 * </pre>
 *
 * <h3>Confidence</h3>
 * Each qualitative rule adds a signed nudge scaled by {@code min(3, 1 + ruleConfidence × 2.5)}.
 * Trend alignment compares the trend with the direction forecast at the horizon being blended,
 * falling back to the primary direction when that horizon has no forecast;
 * a volume breakdown on the pattern record can add a further bonus. The result is clamped to
 * [0, 1] and the level is recomputed from the predictor thresholds.
 *
 * <p>The raw values are kept in {@link BlendAudit}. Pure; no logging.
 */
public class FeedbackBlender {

    private final BlendSettings settings;
    private final PredictorSettings predictorSettings;

    public FeedbackBlender(BlendSettings settings, PredictorSettings predictorSettings) {
        this.settings          = settings.validate();
        this.predictorSettings = predictorSettings;
    }

    public Prediction blend(Prediction prediction, String trend, int horizon, String sector,
                            FeedbackSnapshot snapshot) {
        if (snapshot == null || snapshot.isEmpty()) return prediction;
        String pattern = prediction.pattern();

        // ── win rate ──
        double rawWinRate = prediction.winRate();
        double blendedWinRate = rawWinRate;
        AdjustmentRecord source = selectSource(snapshot, pattern, trend, horizon, sector).orElse(null);
        double weight = 0.0;
        double paperWinRate = 0.0;
        if (source != null) {
            weight         = settings.weightFor(source.totalTrades());
            paperWinRate   = source.paperWinRate();
            blendedWinRate = rawWinRate * (1 - weight) + paperWinRate * weight;
        }

        // ── confidence ──
        List<String> applied = new ArrayList<>();
        double boost = 0.0;
        Direction trendDirection = Direction.ofTrend(trend);
        Direction planDirection = directionAt(prediction, horizon);
        for (QualitativeRule rule : snapshot.rules()) {
            String ctx = rule.context() == null ? "" : rule.context();
            double c = rule.confidence();
            double scale = Math.min(settings.ruleScaleCap(), 1.0 + c * settings.ruleScaleSlope());

            if (QualitativeRule.TREND_ALIGNMENT.equals(ctx) && trend != null) {
                boolean aligned = planDirection != Direction.NEUTRAL && planDirection == trendDirection;
                boost += aligned ? settings.trendAlignedBoost() * scale * c
                                 : -settings.trendAgainstPenalty() * scale * c;
                applied.add(ctx);
            } else if (QualitativeRule.VOLUME_CONFIRMATION.equals(ctx)) {
                boost += settings.volumeConfirmationBoost() * scale * c;
                applied.add(ctx);
            } else if (ctx.startsWith(QualitativeRule.VOLUME_PER_PATTERN)) {
                if (ctx.substring(QualitativeRule.VOLUME_PER_PATTERN.length()).equals(pattern)) {
                    boost += settings.perPatternVolumeBoost() * scale * c;
                    applied.add(ctx);
                }
            } else if (QualitativeRule.STOP_LOSS_TUNING.equals(ctx)) {
                boost -= settings.stopLossTuningPenalty() * scale * c;
                applied.add(ctx);
            }
        }

        Optional<AdjustmentRecord> patternRecord = snapshot.find(AdjustmentKey.pattern(pattern));
        if (patternRecord.isPresent()) {
            AdjustmentRecord pr = patternRecord.get();
            if (pr.volumeConfirmedWinRate() != null && pr.volumeUnconfirmedWinRate() != null) {
                double volumeEdge = (pr.volumeConfirmedWinRate() - pr.volumeUnconfirmedWinRate()) / 100.0;
                if (volumeEdge > settings.volumeEdgeThreshold()) {
                    boost += volumeEdge * settings.volumeEdgeFactor();
                    applied.add("volume_breakdown");
                }
            }
        }

        if (source == null && boost == 0.0) return prediction;

        double confidence = ConfidenceScorer.clamp01(prediction.confidence() + boost);
        ConfidenceLevel level = ConfidenceScorer.level(confidence, predictorSettings);

        BlendAudit audit = new BlendAudit(rawWinRate, prediction.confidence(), prediction.level(),
            source == null ? null : source.key(),
            source == null ? 0 : source.totalTrades(),
            paperWinRate, weight, List.copyOf(applied));
        return prediction.withBlend(blendedWinRate, confidence, level, audit);
    }

    private static Direction directionAt(Prediction prediction, int horizon) {
        HorizonForecast forecast = prediction.horizons() == null ? null : prediction.horizon(horizon);
        return forecast != null && forecast.direction() != null ? forecast.direction() : prediction.direction();
    }

    /** First cascade record that exists and meets its category's minimum trade count. */
    public Optional<AdjustmentRecord> selectSource(FeedbackSnapshot snapshot, String pattern, String trend,
                                                   int horizon, String sector) {
        for (AdjustmentCategory category : settings.cascade()) {
            Optional<AdjustmentKey> key = keyFor(category, pattern, trend, horizon, sector);
            if (key.isEmpty()) continue;
            Optional<AdjustmentRecord> found = snapshot.find(key.get());
            if (found.isPresent() && found.get().totalTrades() >= settings.minTrades().get(category)) {
                return found;
            }
        }
        return Optional.empty();
    }

    private static Optional<AdjustmentKey> keyFor(AdjustmentCategory category, String pattern, String trend,
                                                  int horizon, String sector) {
        boolean hasTrend  = trend != null && !trend.isBlank();
        boolean hasSector = sector != null && !sector.isBlank();
        return switch (category) {
            case TRIPLE  -> hasTrend ? Optional.of(AdjustmentKey.triple(pattern, trend, horizon)) : Optional.empty();
            case HORIZON -> Optional.of(AdjustmentKey.patternHorizon(pattern, horizon));
            case SECTOR  -> hasSector ? Optional.of(AdjustmentKey.patternSector(pattern, sector)) : Optional.empty();
            case REGIME  -> hasTrend ? Optional.of(AdjustmentKey.patternTrend(pattern, trend)) : Optional.empty();
            case PATTERN -> Optional.of(AdjustmentKey.pattern(pattern));
        };
    }
}
