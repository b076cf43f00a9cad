package com.patterntrader.trade.model;

import com.patterntrader.common.risk.CircuitBreaker;
import com.patterntrader.common.risk.RiskState;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.EnumSet;
import java.util.Set;

/**
 * Single persisted row (id = 1) of account risk state. One column per breaker flag so the
 * row can be inspected directly; {@link #toState()} and {@link #apply(RiskState, Instant)} are exact
 * inverses, which keeps a reloaded state's {@code canTrade} answers identical.
 */
@Data
@NoArgsConstructor
@Table("risk_state")
public class RiskStateRecord {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Version
    private Long version;

    private double initialCapital;
    private double capital;
    private double peakCapital;
    private double realizedPnl;

    private LocalDate sessionDate;
    private int tradesToday;
    private double dailyPnl;

    private String month;
    private int tradesThisMonth;
    private double monthlyPnl;

    private int consecutiveLosses;
    private int totalTrades;

    private boolean dailyLossTripped;
    private boolean consecutiveLossesTripped;
    private boolean drawdownTripped;
    private boolean dailyTradeCountTripped;
    private boolean monthlyLossTripped;
    private Instant cooldownUntil;

    private Instant updatedAt;

    public RiskState toState() {
        Set<CircuitBreaker> breakers = EnumSet.noneOf(CircuitBreaker.class);
        if (dailyLossTripped)          breakers.add(CircuitBreaker.DAILY_LOSS);
        if (consecutiveLossesTripped)  breakers.add(CircuitBreaker.CONSECUTIVE_LOSSES);
        if (drawdownTripped)           breakers.add(CircuitBreaker.DRAWDOWN);
        if (dailyTradeCountTripped)    breakers.add(CircuitBreaker.DAILY_TRADE_COUNT);
        if (monthlyLossTripped)        breakers.add(CircuitBreaker.MONTHLY_LOSS);
        return new RiskState(initialCapital, capital, peakCapital, realizedPnl, sessionDate, tradesToday, dailyPnl,
            month == null ? null : YearMonth.parse(month), tradesThisMonth, monthlyPnl, consecutiveLosses,
            totalTrades, breakers, cooldownUntil);
    }

    /** Copies every field of {@code s} onto this row, keeping id and version. */
    public RiskStateRecord apply(RiskState s, Instant now) {
        initialCapital  = s.initialCapital();
        capital         = s.capital();
        peakCapital     = s.peakCapital();
        realizedPnl     = s.realizedPnl();
        sessionDate     = s.sessionDate();
        tradesToday     = s.tradesToday();
        dailyPnl        = s.dailyPnl();
        month           = s.month() == null ? null : s.month().toString();
        tradesThisMonth = s.tradesThisMonth();
        monthlyPnl      = s.monthlyPnl();
        consecutiveLosses = s.consecutiveLosses();
        totalTrades     = s.totalTrades();
        dailyLossTripped         = s.isTripped(CircuitBreaker.DAILY_LOSS);
        consecutiveLossesTripped = s.isTripped(CircuitBreaker.CONSECUTIVE_LOSSES);
        drawdownTripped          = s.isTripped(CircuitBreaker.DRAWDOWN);
        dailyTradeCountTripped   = s.isTripped(CircuitBreaker.DAILY_TRADE_COUNT);
        monthlyLossTripped       = s.isTripped(CircuitBreaker.MONTHLY_LOSS);
        cooldownUntil   = s.cooldownUntil();
        updatedAt       = now;
        return this;
    }

    public static RiskStateRecord create(RiskState initial, Instant now) {
        RiskStateRecord r = new RiskStateRecord();
        r.setId(SINGLETON_ID);
        return r.apply(initial, now);
    }
}
