package com.patterntrader.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a risk gate. A rejection names the condition, the current value and the
 * threshold it crossed; it is a normal result, not an error.
 *
 * @param reason   breaker reason ({@code daily_loss}), {@code cooldown}, or a pre-entry gate name
 * @param breaker  set only when a circuit breaker caused the rejection
 */
public record RiskCheckResult(
    @JsonProperty("allowed")      boolean allowed,
    @JsonProperty("reason")       String reason,
    @JsonProperty("breaker")      CircuitBreaker breaker,
    @JsonProperty("currentValue") double currentValue,
    @JsonProperty("threshold")    double threshold,
    @JsonProperty("message")      String message
) {

    public static final String COOLDOWN             = "cooldown";
    public static final String SECTOR_CONCENTRATION = "sector_concentration";
    public static final String POSITION_LIMIT       = "position_limit";

    public static RiskCheckResult allow() {
        return new RiskCheckResult(true, null, null, 0.0, 0.0, "allowed");
    }

    public static RiskCheckResult breaker(CircuitBreaker breaker, double value, double threshold) {
        return new RiskCheckResult(false, breaker.reason(), breaker, value, threshold,
            String.format("%s tripped: %.2f >= %.2f", breaker.reason(), value, threshold));
    }

    public static RiskCheckResult gate(String reason, double value, double threshold) {
        return new RiskCheckResult(false, reason, null, value, threshold,
            String.format("%s: %.2f exceeds %.2f", reason, value, threshold));
    }

    /** @param remainingMinutes minutes until the cooldown ends */
    public static RiskCheckResult cooldown(double remainingMinutes, String until) {
        return new RiskCheckResult(false, COOLDOWN, null, remainingMinutes, 0.0,
            String.format("cooldown active until %s (%.1f min left)", until, remainingMinutes));
    }
}
