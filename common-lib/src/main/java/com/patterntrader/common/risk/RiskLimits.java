package com.patterntrader.common.risk;

import com.patterntrader.common.exception.InvalidConfigurationException;

import java.time.Duration;

/**
 * Circuit-breaker thresholds and pre-entry limits.
 *
 * @param maxMonthlyLossPct       measured against initial capital
 * @param maxConcurrentPositions  horizon-weighted: an open trade counts {@code horizon / horizonWeightBase}
 */
public record RiskLimits(
    double maxDailyLossPct,
    int maxConsecutiveLosses,
    double maxDrawdownPct,
    int maxDailyTrades,
    double maxMonthlyLossPct,
    Duration cooldown,
    int maxPositionsPerSector,
    double maxConcurrentPositions,
    double horizonWeightBase
) {

    public static RiskLimits defaults() {
        return new RiskLimits(2.0, 5, 10.0, 10, 5.0, Duration.ofMinutes(60), 2, 10.0, 5.0);
    }

    public RiskLimits validate() {
        require(maxDailyLossPct > 0 && maxDailyLossPct <= 100, "maxDailyLossPct must be in (0,100]");
        require(maxConsecutiveLosses > 0, "maxConsecutiveLosses must be positive");
        require(maxDrawdownPct > 0 && maxDrawdownPct <= 100, "maxDrawdownPct must be in (0,100]");
        require(maxDailyTrades > 0, "maxDailyTrades must be positive");
        require(maxMonthlyLossPct > 0 && maxMonthlyLossPct <= 100, "maxMonthlyLossPct must be in (0,100]");
        require(cooldown != null && !cooldown.isNegative(), "cooldown must be >= 0");
        require(maxPositionsPerSector > 0, "maxPositionsPerSector must be positive");
        require(maxConcurrentPositions > 0, "maxConcurrentPositions must be positive");
        require(horizonWeightBase > 0, "horizonWeightBase must be positive");
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) throw new InvalidConfigurationException("RiskLimits", message);
    }
}
