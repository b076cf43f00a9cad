package com.patterntrader.common.prediction;

/**
 * ATR-based stop distance in percent of price, clamped to the configured floor and cap.
 */
public final class StopLossCalculator {

    private StopLossCalculator() {}

    public static double stopLossPct(String pattern, double atr, double price, StopLossSettings settings) {
        return stopLossPct(pattern, atr, price, 1.0, settings.capPct(), settings);
    }

    /**
     * @param scale  horizon-specific multiplier on the ATR distance
     * @param cap    horizon-specific cap; the effective cap is the smaller of this and the global cap
     */
    public static double stopLossPct(String pattern, double atr, double price, double scale, double cap,
                                     StopLossSettings settings) {
        double raw;
        if (atr > 0 && price > 0) {
            raw = scale * settings.multiplierFor(pattern) * atr / price * 100.0;
        } else {
            raw = settings.fallbackPct();
        }
        double effectiveCap = Math.min(cap, settings.capPct());
        return Math.max(settings.floorPct(), Math.min(raw, effectiveCap));
    }
}
