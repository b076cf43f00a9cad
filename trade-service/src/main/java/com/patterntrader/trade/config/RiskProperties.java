package com.patterntrader.trade.config;

import com.patterntrader.common.risk.RiskLimits;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "risk")
public class RiskProperties {

    /** Capital of a brand-new account; ignored once a risk_state row exists. */
    private double initialCapital = 1_000_000.0;

    /** Zone whose calendar decides daily and monthly rollover. */
    private String zone = "Asia/Kolkata";

    private double maxDailyLossPct = 2.0;
    private int maxConsecutiveLosses = 5;
    private double maxDrawdownPct = 10.0;
    private int maxDailyTrades = 10;
    private double maxMonthlyLossPct = 5.0;
    private Duration cooldown = Duration.ofMinutes(60);

    private int maxPositionsPerSector = 2;
    private double maxConcurrentPositions = 10.0;
    private double horizonWeightBase = 5.0;

    public RiskLimits toLimits() {
        return new RiskLimits(maxDailyLossPct, maxConsecutiveLosses, maxDrawdownPct, maxDailyTrades,
            maxMonthlyLossPct, cooldown, maxPositionsPerSector, maxConcurrentPositions, horizonWeightBase).validate();
    }
}
