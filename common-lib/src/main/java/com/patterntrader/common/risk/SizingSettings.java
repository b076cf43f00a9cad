package com.patterntrader.common.risk;

import com.patterntrader.common.exception.InvalidConfigurationException;
import com.patterntrader.common.model.ConfidenceLevel;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Fractional-Kelly sizing parameters. Percentages are of capital (3.0 = 3%).
 *
 * @param horizonMultipliers  keyed by horizon label; missing horizons use 1.0
 * @param sectorMultipliers   keyed by lower-case sector; missing sectors use 1.0
 */
public record SizingSettings(
    double kellyFraction,
    double minPositionPct,
    double maxPositionPct,
    double defaultCapital,
    Map<ConfidenceLevel, Double> confidenceMultipliers,
    double unknownConfidenceMultiplier,
    Map<String, Double> horizonMultipliers,
    Map<String, Double> sectorMultipliers
) {

    public SizingSettings {
        confidenceMultipliers = Map.copyOf(confidenceMultipliers);
        horizonMultipliers    = Map.copyOf(horizonMultipliers);
        sectorMultipliers     = Map.copyOf(sectorMultipliers);
    }

    public static SizingSettings defaults() {
        Map<ConfidenceLevel, Double> confidence = new EnumMap<>(ConfidenceLevel.class);
        confidence.put(ConfidenceLevel.HIGH,   1.0);
        confidence.put(ConfidenceLevel.MEDIUM, 0.7);
        confidence.put(ConfidenceLevel.LOW,    0.4);

        Map<String, Double> sectors = new HashMap<>();
        sectors.put("banking", 0.85);       sectors.put("finance", 0.85);
        sectors.put("metals", 0.80);        sectors.put("realty", 0.75);
        sectors.put("energy", 0.90);        sectors.put("it", 0.95);
        sectors.put("pharma", 1.0);         sectors.put("fmcg", 1.05);
        sectors.put("auto", 0.9);           sectors.put("chemicals", 0.9);
        sectors.put("capital_goods", 0.9);  sectors.put("cement", 0.95);
        sectors.put("infra", 0.85);         sectors.put("consumer", 0.95);
        sectors.put("defence", 0.9);        sectors.put("telecom", 0.95);
        sectors.put("media", 0.85);         sectors.put("consumer_tech", 0.9);
        sectors.put("logistics", 0.9);      sectors.put("textiles", 0.85);
        sectors.put("diversified", 0.9);    sectors.put("commodity", 0.8);
        sectors.put("index_in", 1.0);       sectors.put("index_us", 1.0);
        sectors.put("index_asia", 0.9);     sectors.put("index_eu", 0.95);

        return new SizingSettings(0.5, 0.5, 3.0, 1_000_000.0, confidence, 0.5,
            Map.of("BTST_1d", 1.2, "Swing_3d", 1.0, "Swing_5d", 0.9, "Swing_10d", 0.8),
            sectors);
    }

    public double confidenceMultiplier(ConfidenceLevel level) {
        return level == null ? unknownConfidenceMultiplier
                             : confidenceMultipliers.getOrDefault(level, unknownConfidenceMultiplier);
    }

    public double horizonMultiplier(String horizonLabel) {
        return horizonLabel == null ? 1.0 : horizonMultipliers.getOrDefault(horizonLabel, 1.0);
    }

    public double sectorMultiplier(String sector) {
        return sector == null ? 1.0 : sectorMultipliers.getOrDefault(sector.trim().toLowerCase(), 1.0);
    }

    public SizingSettings validate() {
        require(kellyFraction > 0 && kellyFraction <= 1, "kellyFraction must be in (0,1]");
        require(minPositionPct >= 0, "minPositionPct must be >= 0");
        require(maxPositionPct > 0 && maxPositionPct <= 100, "maxPositionPct must be in (0,100]");
        require(minPositionPct <= maxPositionPct,
                "minPositionPct " + minPositionPct + " exceeds maxPositionPct " + maxPositionPct);
        require(defaultCapital > 0, "defaultCapital must be positive");
        require(unknownConfidenceMultiplier >= 0, "unknownConfidenceMultiplier must be >= 0");
        require(confidenceMultipliers.values().stream().allMatch(v -> v >= 0), "confidence multipliers must be >= 0");
        require(horizonMultipliers.values().stream().allMatch(v -> v >= 0), "horizon multipliers must be >= 0");
        require(sectorMultipliers.values().stream().allMatch(v -> v >= 0), "sector multipliers must be >= 0");
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) throw new InvalidConfigurationException("SizingSettings", message);
    }
}
