package com.patterntrader.orchestrator.dto;

public enum SessionStatus {
    /** Monitored, predicted and submitted. */
    COMPLETED,
    /** Monitored only: a circuit breaker or cooldown blocks new entries. */
    RISK_BLOCKED,
    /** Monitored only: the market regime scales every position to zero. */
    REGIME_HALTED
}
