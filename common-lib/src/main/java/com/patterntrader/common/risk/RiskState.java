package com.patterntrader.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.EnumSet;
import java.util.Set;

/**
 * Account risk state. Immutable; every transition returns a new instance.
 *
 * <p>{@code capital == initialCapital + realizedPnl} holds for every state produced by
 * {@link CircuitBreakerEvaluator}.
 *
 * @param sessionDate    date the daily counters belong to
 * @param month          month the monthly counters belong to
 * @param cooldownUntil  entries are blocked before this instant; null when no cooldown
 */
public record RiskState(
    @JsonProperty("initialCapital")    double initialCapital,
    @JsonProperty("capital")           double capital,
    @JsonProperty("peakCapital")       double peakCapital,
    @JsonProperty("realizedPnl")       double realizedPnl,
    @JsonProperty("sessionDate")       LocalDate sessionDate,
    @JsonProperty("tradesToday")       int tradesToday,
    @JsonProperty("dailyPnl")          double dailyPnl,
    @JsonProperty("month")             YearMonth month,
    @JsonProperty("tradesThisMonth")   int tradesThisMonth,
    @JsonProperty("monthlyPnl")        double monthlyPnl,
    @JsonProperty("consecutiveLosses") int consecutiveLosses,
    @JsonProperty("totalTrades")       int totalTrades,
    @JsonProperty("breakers")          Set<CircuitBreaker> breakers,
    @JsonProperty("cooldownUntil")     Instant cooldownUntil
) {

    public RiskState {
        breakers = breakers == null || breakers.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(breakers));
    }

    public boolean isTripped(CircuitBreaker breaker) {
        return breakers.contains(breaker);
    }

    /** Capital at the start of the current session. */
    public double dayStartCapital() {
        return capital - dailyPnl;
    }

    public double drawdownPct() {
        return peakCapital > 0 ? (peakCapital - capital) / peakCapital * 100.0 : 0.0;
    }

    public double dailyLossPct() {
        double base = dayStartCapital();
        return dailyPnl < 0 && base > 0 ? -dailyPnl / base * 100.0 : 0.0;
    }

    public double monthlyLossPct() {
        return monthlyPnl < 0 && initialCapital > 0 ? -monthlyPnl / initialCapital * 100.0 : 0.0;
    }

    public RiskState withBreakers(Set<CircuitBreaker> next, Instant nextCooldown) {
        return new RiskState(initialCapital, capital, peakCapital, realizedPnl, sessionDate, tradesToday, dailyPnl,
            month, tradesThisMonth, monthlyPnl, consecutiveLosses, totalTrades, next, nextCooldown);
    }
}
