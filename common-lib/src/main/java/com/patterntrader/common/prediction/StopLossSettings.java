package com.patterntrader.common.prediction;

import com.patterntrader.common.exception.InvalidConfigurationException;

import java.util.Set;

/**
 * ATR stop-loss parameters. Structural patterns (wide-bodied or multi-bar shapes)
 * get the wider multiplier.
 */
public record StopLossSettings(
    double atrMultiplier,
    double structuralAtrMultiplier,
    Set<String> structuralPatterns,
    double fallbackPct,
    double floorPct,
    double capPct
) {

    public StopLossSettings {
        structuralPatterns = structuralPatterns == null ? Set.of() : Set.copyOf(structuralPatterns);
    }

    public static StopLossSettings defaults() {
        return new StopLossSettings(1.5, 2.0,
            Set.of("bullish_harami", "belt_hold_bearish", "bullish_kicker", "ladder_bottom", "mat_hold"),
            1.0, 0.3, 5.0);
    }

    public double multiplierFor(String pattern) {
        return pattern != null && structuralPatterns.contains(pattern) ? structuralAtrMultiplier : atrMultiplier;
    }

    public void validate() {
        if (atrMultiplier <= 0 || structuralAtrMultiplier <= 0)
            throw new InvalidConfigurationException("StopLossSettings", "ATR multipliers must be positive");
        if (floorPct <= 0 || capPct <= 0 || floorPct > capPct)
            throw new InvalidConfigurationException("StopLossSettings",
                "stop-loss bounds must satisfy 0 < floor <= cap, got floor=" + floorPct + " cap=" + capPct);
        if (fallbackPct <= 0)
            throw new InvalidConfigurationException("StopLossSettings", "fallbackPct must be positive");
    }
}
