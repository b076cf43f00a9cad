package com.patterntrader.common.trade;

import com.patterntrader.common.exception.InvalidConfigurationException;

import java.util.Map;

/**
 * Per-horizon trade parameters.
 *
 * @param stopLossScale  multiplier on the ATR stop distance; short holds get tighter stops
 * @param stopLossCap    cap on the stop distance in percent
 * @param minRewardRisk  target distance is at least {@code stop × minRewardRisk}
 */
public record HorizonPlan(int horizonDays, double stopLossScale, double stopLossCap, double minRewardRisk) {

    public static Map<Integer, HorizonPlan> defaults() {
        return Map.of(
            1,  new HorizonPlan(1,  0.7, 2.5, 1.5),
            3,  new HorizonPlan(3,  0.8, 3.5, 1.8),
            5,  new HorizonPlan(5,  1.0, 5.0, 2.0),
            10, new HorizonPlan(10, 1.2, 5.0, 2.0));
    }

    public HorizonPlan validate() {
        if (horizonDays <= 0 || stopLossScale <= 0 || stopLossCap <= 0 || minRewardRisk <= 0)
            throw new InvalidConfigurationException("HorizonPlan",
                "horizon " + horizonDays + " needs positive scale, cap and reward/risk");
        return this;
    }
}
