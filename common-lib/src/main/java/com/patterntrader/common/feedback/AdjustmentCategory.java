package com.patterntrader.common.feedback;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Segmentation of realized outcomes, each with the key fields it requires.
 *
 * <p>The JSON names match the external feedback-store layout
 * ({@code pattern_adjustments}, {@code triple_adjustments}, ...).
 */
public enum AdjustmentCategory {
    PATTERN("pattern_adjustments",  false, false, false),
    REGIME ("regime_adjustments",   true,  false, false),
    HORIZON("horizon_adjustments",  false, true,  false),
    TRIPLE ("triple_adjustments",   true,  true,  false),
    SECTOR ("sector_adjustments",   false, false, true);

    private final String storeName;
    private final boolean needsTrend;
    private final boolean needsHorizon;
    private final boolean needsSector;

    AdjustmentCategory(String storeName, boolean needsTrend, boolean needsHorizon, boolean needsSector) {
        this.storeName    = storeName;
        this.needsTrend   = needsTrend;
        this.needsHorizon = needsHorizon;
        this.needsSector  = needsSector;
    }

    @JsonValue
    public String storeName() {
        return storeName;
    }

    public boolean needsTrend()   { return needsTrend; }
    public boolean needsHorizon() { return needsHorizon; }
    public boolean needsSector()  { return needsSector; }

    public static AdjustmentCategory fromStoreName(String name) {
        for (AdjustmentCategory c : values()) {
            if (c.storeName.equals(name) || c.name().equals(name)) return c;
        }
        throw new IllegalArgumentException("Unknown adjustment category: " + name);
    }
}
