package com.patterntrader.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse market classification used to scale position size globally.
 *
 * <ul>
 *   <li>{@link #BULL_LOW_VOL}:  index above its long average, calm volatility</li>
 *   <li>{@link #BULL_HIGH_VOL}: index above its long average, elevated volatility</li>
 *   <li>{@link #BEAR_LOW_VOL}:  index below its long average, calm volatility</li>
 *   <li>{@link #BEAR_HIGH_VOL}: index below its long average, elevated volatility</li>
 *   <li>{@link #EXTREME}:       volatility index above the extreme threshold; no trading</li>
 * </ul>
 */
public enum MarketRegime {
    BULL_LOW_VOL,
    BULL_HIGH_VOL,
    BEAR_LOW_VOL,
    BEAR_HIGH_VOL,
    EXTREME;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
