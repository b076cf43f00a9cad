package com.patterntrader.common.risk;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Account-level conditions that halt new entries.
 *
 * <ul>
 *   <li>{@link #DAILY_LOSS}, {@link #DAILY_TRADE_COUNT}: clear on date rollover</li>
 *   <li>{@link #MONTHLY_LOSS}: clears on month rollover</li>
 *   <li>{@link #CONSECUTIVE_LOSSES}, {@link #DRAWDOWN}: clear when the cooldown elapses</li>
 * </ul>
 * All of them clear on a confirmed manual reset.
 */
public enum CircuitBreaker {
    DAILY_LOSS("daily_loss"),
    CONSECUTIVE_LOSSES("consecutive_losses"),
    DRAWDOWN("drawdown"),
    DAILY_TRADE_COUNT("daily_trade_count"),
    MONTHLY_LOSS("monthly_loss");

    private final String reason;

    CircuitBreaker(String reason) {
        this.reason = reason;
    }

    @JsonValue
    public String reason() {
        return reason;
    }
}
