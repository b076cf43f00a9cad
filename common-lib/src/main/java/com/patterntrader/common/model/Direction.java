package com.patterntrader.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Realized or predicted price direction over a horizon.
 *
 * <p>Serialized in lower case ({@code "bullish"}) to match the observation feed.
 */
public enum Direction {
    BULLISH,
    BEARISH,
    NEUTRAL;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    /** Lenient parse; unknown or blank labels map to {@link #NEUTRAL}. */
    @JsonCreator
    public static Direction fromLabel(String label) {
        if (label == null || label.isBlank()) return NEUTRAL;
        return switch (label.trim().toLowerCase()) {
            case "bullish", "up", "long"    -> BULLISH;
            case "bearish", "down", "short" -> BEARISH;
            default                         -> NEUTRAL;
        };
    }

    /**
     * Direction implied by a trend tag ({@code "uptrend"}, {@code "strong_bearish"}, ...);
     * sideways or unknown trends are {@link #NEUTRAL}.
     */
    public static Direction ofTrend(String trend) {
        if (trend == null) return NEUTRAL;
        String t = trend.toLowerCase();
        if (t.contains("up") || t.contains("bull")) return BULLISH;
        if (t.contains("down") || t.contains("bear")) return BEARISH;
        return NEUTRAL;
    }

    /** +1 for bullish, -1 for bearish, 0 for neutral. */
    public int sign() {
        return switch (this) {
            case BULLISH -> 1;
            case BEARISH -> -1;
            case NEUTRAL -> 0;
        };
    }
}
