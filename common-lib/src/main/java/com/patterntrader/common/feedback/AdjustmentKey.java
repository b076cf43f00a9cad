package com.patterntrader.common.feedback;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Composite key of an adjustment record. The category decides which optional fields
 * must be present; fields the category does not use are always null, so two keys are
 * equal exactly when they address the same segment.
 */
public record AdjustmentKey(
    @JsonProperty("category") AdjustmentCategory category,
    @JsonProperty("pattern")  String pattern,
    @JsonProperty("trend")    String trend,
    @JsonProperty("horizon")  Integer horizon,
    @JsonProperty("sector")   String sector
) {

    public AdjustmentKey {
        Objects.requireNonNull(category, "category");
        pattern = normalize(pattern);
        trend   = category.needsTrend()   ? normalize(trend)  : null;
        horizon = category.needsHorizon() ? horizon           : null;
        sector  = category.needsSector()  ? normalize(sector) : null;
        if (pattern == null)
            throw new IllegalArgumentException("pattern is required for " + category);
        if (category.needsTrend() && trend == null)
            throw new IllegalArgumentException("trend is required for " + category);
        if (category.needsHorizon() && (horizon == null || horizon <= 0))
            throw new IllegalArgumentException("horizon is required for " + category);
        if (category.needsSector() && sector == null)
            throw new IllegalArgumentException("sector is required for " + category);
    }

    public static AdjustmentKey pattern(String pattern) {
        return new AdjustmentKey(AdjustmentCategory.PATTERN, pattern, null, null, null);
    }

    public static AdjustmentKey patternTrend(String pattern, String trend) {
        return new AdjustmentKey(AdjustmentCategory.REGIME, pattern, trend, null, null);
    }

    public static AdjustmentKey patternHorizon(String pattern, int horizon) {
        return new AdjustmentKey(AdjustmentCategory.HORIZON, pattern, null, horizon, null);
    }

    public static AdjustmentKey triple(String pattern, String trend, int horizon) {
        return new AdjustmentKey(AdjustmentCategory.TRIPLE, pattern, trend, horizon, null);
    }

    public static AdjustmentKey patternSector(String pattern, String sector) {
        return new AdjustmentKey(AdjustmentCategory.SECTOR, pattern, null, null, sector);
    }

    private static String normalize(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase();
        return v.isEmpty() ? null : v;
    }
}
