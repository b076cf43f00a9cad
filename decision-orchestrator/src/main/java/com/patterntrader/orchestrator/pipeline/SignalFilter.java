package com.patterntrader.orchestrator.pipeline;

import com.patterntrader.common.exception.InvalidConfigurationException;

/**
 * Last gate between a blended prediction and a trade signal.
 *
 * @param boostWinRateRelief  win-rate points forgiven when feedback boosts the segment;
 *                            a boost also lets LOW confidence through
 */
public record SignalFilter(double minWinRate, boolean rejectLowConfidence,
                           double minRewardRisk, double boostWinRateRelief) {

    public SignalFilter validate() {
        if (minWinRate < 0 || minWinRate > 100)
            throw new InvalidConfigurationException("SignalFilter", "minWinRate must be in [0,100]");
        if (minRewardRisk <= 0)
            throw new InvalidConfigurationException("SignalFilter", "minRewardRisk must be positive");
        if (boostWinRateRelief < 0 || boostWinRateRelief > minWinRate)
            throw new InvalidConfigurationException("SignalFilter",
                "boostWinRateRelief must be in [0, minWinRate]");
        return this;
    }
}
