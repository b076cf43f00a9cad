package com.patterntrader.orchestrator.config;

import com.patterntrader.common.classifier.RegimeSettings;
import com.patterntrader.common.exception.InvalidConfigurationException;
import com.patterntrader.common.feedback.BlendSettings;
import com.patterntrader.common.model.MarketRegime;
import com.patterntrader.common.model.RetrievalTier;
import com.patterntrader.common.prediction.PatternFilter;
import com.patterntrader.common.prediction.PredictorSettings;
import com.patterntrader.common.prediction.StopLossSettings;
import com.patterntrader.common.risk.SizingSettings;
import com.patterntrader.common.trade.HorizonPlan;
import com.patterntrader.orchestrator.pipeline.SignalFilter;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Every tunable of the session pipeline under {@code trading.*}.
 *
 * <p>Unset values fall back to the historically tuned defaults of the settings records.
 * The {@code to*} converters validate, so a bad value stops the context at startup.
 */
@Data
@ConfigurationProperties(prefix = "trading")
public class TradingProperties {

    private Predictor predictor = new Predictor();
    private StopLoss stopLoss = new StopLoss();
    private Blend blend = new Blend();
    private Sizing sizing = new Sizing();
    private Regime regime = new Regime();
    private List<Horizon> horizons = defaultHorizons();
    private Filter filter = new Filter();

    /** Zone whose calendar decides which session is "today". */
    private String zone = "Asia/Kolkata";

    /** Snapshots older than this are ignored and the session runs on raw predictions. */
    private Duration feedbackMaxAge = Duration.ofDays(7);

    // ── nested groups ─────────────────────────────────────────────────────────

    @Data
    public static class Predictor {
        private static final PredictorSettings D = PredictorSettings.defaults();

        private int minMatches = D.minMatches();
        private int topK = D.topK();
        private int maxPerInstrument = D.maxPerInstrument();
        private int maxPerSector = D.maxPerSector();
        private int minIndices = D.minIndices();
        private List<Integer> horizons = new ArrayList<>(D.horizons());
        private int primaryHorizon = D.primaryHorizon();
        private double edgeThreshold = D.edgeThreshold();
        private Set<RetrievalTier> allowedTiers = EnumSet.copyOf(D.allowedTiers());
        private double edgeWeight = D.edgeWeight();
        private double sampleWeight = D.sampleWeight();
        private double tierWeight = D.tierWeight();
        private double profitFactorWeight = D.profitFactorWeight();
        private int sampleSaturation = D.sampleSaturation();
        private double highThreshold = D.highThreshold();
        private double mediumThreshold = D.mediumThreshold();
        private Set<String> excludedPatterns = new HashSet<>(D.patternFilter().excluded());
        private Set<String> whitelist = new HashSet<>(D.patternFilter().whitelist());
    }

    @Data
    public static class StopLoss {
        private static final StopLossSettings D = StopLossSettings.defaults();

        private double atrMultiplier = D.atrMultiplier();
        private double structuralAtrMultiplier = D.structuralAtrMultiplier();
        private Set<String> structuralPatterns = new HashSet<>(D.structuralPatterns());
        private double fallbackPct = D.fallbackPct();
        private double floorPct = D.floorPct();
        private double capPct = D.capPct();
    }

    @Data
    public static class Blend {
        private static final BlendSettings D = BlendSettings.defaults();

        private double weightCap = D.weightCap();
        private double weightPrior = D.weightPrior();
        private double ruleScaleSlope = D.ruleScaleSlope();
        private double ruleScaleCap = D.ruleScaleCap();
    }

    @Data
    public static class Sizing {
        private static final SizingSettings D = SizingSettings.defaults();

        private double kellyFraction = D.kellyFraction();
        private double minPositionPct = D.minPositionPct();
        private double maxPositionPct = D.maxPositionPct();
        private double defaultCapital = D.defaultCapital();
        private Map<String, Double> horizonMultipliers = new HashMap<>(D.horizonMultipliers());
        private Map<String, Double> sectorMultipliers = new HashMap<>(D.sectorMultipliers());
    }

    @Data
    public static class Regime {
        private static final RegimeSettings D = RegimeSettings.defaults();

        private int movingAverageLength = D.movingAverageLength();
        private double highVolatility = D.highVolatility();
        private double extremeVolatility = D.extremeVolatility();
        private Map<MarketRegime, Double> scales = new EnumMap<>(D.scales());
    }

    @Data
    public static class Horizon {
        private int days;
        private double stopLossScale;
        private double stopLossCap;
        private double minRewardRisk;

        public Horizon() {}

        Horizon(HorizonPlan plan) {
            this.days          = plan.horizonDays();
            this.stopLossScale = plan.stopLossScale();
            this.stopLossCap   = plan.stopLossCap();
            this.minRewardRisk = plan.minRewardRisk();
        }
    }

    @Data
    public static class Filter {
        private double minWinRate = 55.0;
        private boolean rejectLowConfidence = true;
        private double minRewardRisk = 1.5;
        private double boostWinRateRelief = 5.0;
    }

    // ── conversion ────────────────────────────────────────────────────────────

    public StopLossSettings toStopLossSettings() {
        StopLossSettings settings = new StopLossSettings(stopLoss.atrMultiplier, stopLoss.structuralAtrMultiplier,
            lower(stopLoss.structuralPatterns), stopLoss.fallbackPct, stopLoss.floorPct, stopLoss.capPct);
        settings.validate();
        return settings;
    }

    public PredictorSettings toPredictorSettings() {
        PredictorSettings d = PredictorSettings.defaults();
        return new PredictorSettings(
            predictor.minMatches, predictor.topK, predictor.maxPerInstrument, predictor.maxPerSector,
            predictor.minIndices, List.copyOf(predictor.horizons), predictor.primaryHorizon,
            predictor.edgeThreshold, tiers(predictor.allowedTiers), d.tierQuality(),
            predictor.edgeWeight, predictor.sampleWeight, predictor.tierWeight, predictor.profitFactorWeight,
            predictor.sampleSaturation, predictor.highThreshold, predictor.mediumThreshold,
            new PatternFilter(lower(predictor.excludedPatterns), lower(predictor.whitelist)),
            toStopLossSettings()).validate();
    }

    public BlendSettings toBlendSettings() {
        BlendSettings d = BlendSettings.defaults();
        return new BlendSettings(d.cascade(), d.minTrades(), blend.weightCap, blend.weightPrior,
            blend.ruleScaleSlope, blend.ruleScaleCap, d.trendAlignedBoost(), d.trendAgainstPenalty(),
            d.volumeConfirmationBoost(), d.perPatternVolumeBoost(), d.stopLossTuningPenalty(),
            d.volumeEdgeThreshold(), d.volumeEdgeFactor()).validate();
    }

    public SizingSettings toSizingSettings() {
        SizingSettings d = SizingSettings.defaults();
        Map<String, Double> sectors = new HashMap<>();
        sizing.sectorMultipliers.forEach((k, v) -> sectors.put(k.trim().toLowerCase(), v));
        return new SizingSettings(sizing.kellyFraction, sizing.minPositionPct, sizing.maxPositionPct,
            sizing.defaultCapital, d.confidenceMultipliers(), d.unknownConfidenceMultiplier(),
            sizing.horizonMultipliers, sectors).validate();
    }

    public RegimeSettings toRegimeSettings() {
        return new RegimeSettings(regime.movingAverageLength, regime.highVolatility, regime.extremeVolatility,
            regime.scales, RegimeSettings.defaults().horizonScales()).validate();
    }

    /**
     * Trade horizons keyed by days, ascending. Every trade horizon must also be a
     * predictor horizon, otherwise it would never get a forecast.
     */
    public Map<Integer, HorizonPlan> toHorizonPlans() {
        if (horizons == null || horizons.isEmpty())
            throw new InvalidConfigurationException("TradingProperties", "at least one trade horizon is required");
        Map<Integer, HorizonPlan> plans = new TreeMap<>();
        for (Horizon h : horizons) {
            HorizonPlan plan = new HorizonPlan(h.days, h.stopLossScale, h.stopLossCap, h.minRewardRisk).validate();
            if (!predictor.horizons.contains(plan.horizonDays()))
                throw new InvalidConfigurationException("TradingProperties",
                    "trade horizon " + plan.horizonDays() + " is not a predictor horizon " + predictor.horizons);
            if (plans.put(plan.horizonDays(), plan) != null)
                throw new InvalidConfigurationException("TradingProperties",
                    "trade horizon " + plan.horizonDays() + " is configured twice");
        }
        return plans;
    }

    public SignalFilter toSignalFilter() {
        return new SignalFilter(filter.minWinRate, filter.rejectLowConfidence,
            filter.minRewardRisk, filter.boostWinRateRelief).validate();
    }

    private static List<Horizon> defaultHorizons() {
        return new ArrayList<>(new TreeMap<>(HorizonPlan.defaults()).values().stream().map(Horizon::new).toList());
    }

    private static Set<RetrievalTier> tiers(Set<RetrievalTier> allowed) {
        Set<RetrievalTier> out = EnumSet.noneOf(RetrievalTier.class);
        if (allowed != null) out.addAll(allowed);
        return out;
    }

    private static Set<String> lower(Set<String> values) {
        Set<String> out = new HashSet<>();
        if (values == null) return out;
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim().toLowerCase());
        }
        return out;
    }
}
