package com.patterntrader.common.index;

/**
 * Unconditional direction frequencies (0–1) over every indexed observation at one horizon.
 */
public record BaseRates(int horizon, double bullish, double bearish, double neutral, int sampleSize) {

    public static BaseRates uniform(int horizon) {
        return new BaseRates(horizon, 1.0 / 3, 1.0 / 3, 1.0 / 3, 0);
    }
}
