package com.patterntrader.common.risk;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Pure state machine behind the risk manager.
 *
 * <p>State is a set of breaker flags plus a cooldown instant. {@link #canTrade} is true iff no
 * flag is set and {@code now} is not before {@code cooldownUntil}. Every breaker whose condition
 * holds after a trade close is flagged and (re)starts the cooldown window.
 *
 * <p>Time-driven transitions are applied by {@link #refresh} before every read and write:
 * <ul>
 *   <li>date rollover: daily counters reset, daily breakers clear</li>
 *   <li>month rollover: monthly pnl resets, monthly breaker clears</li>
 *   <li>cooldown elapsed: consecutive-loss and drawdown breakers clear</li>
 * </ul>
 * Since every transition is a function of the persisted fields and the clock, a reloaded state
 * answers {@link #canTrade} exactly like the one that was saved.
 *
 * <p>No reactive types. No logging.
 */
public final class CircuitBreakerEvaluator {

    private CircuitBreakerEvaluator() {}

    public static RiskState initial(double capital, Instant now, ZoneId zone) {
        LocalDate today = LocalDate.ofInstant(now, zone);
        return new RiskState(capital, capital, capital, 0.0, today, 0, 0.0, YearMonth.from(today),
                             0, 0.0, 0, 0, Set.of(), null);
    }

    // ── time-driven transitions ───────────────────────────────────────────────

    public static RiskState refresh(RiskState s, Instant now, ZoneId zone) {
        LocalDate today = LocalDate.ofInstant(now, zone);
        YearMonth month = YearMonth.from(today);

        EnumSet<CircuitBreaker> breakers = copy(s.breakers());
        LocalDate sessionDate = s.sessionDate();
        int tradesToday = s.tradesToday();
        double dailyPnl = s.dailyPnl();
        YearMonth currentMonth = s.month();
        int tradesThisMonth = s.tradesThisMonth();
        double monthlyPnl = s.monthlyPnl();
        Instant cooldownUntil = s.cooldownUntil();

        if (sessionDate == null || today.isAfter(sessionDate)) {
            sessionDate = today;
            tradesToday = 0;
            dailyPnl    = 0.0;
            breakers.remove(CircuitBreaker.DAILY_LOSS);
            breakers.remove(CircuitBreaker.DAILY_TRADE_COUNT);
        }
        if (currentMonth == null || month.isAfter(currentMonth)) {
            currentMonth    = month;
            tradesThisMonth = 0;
            monthlyPnl      = 0.0;
            breakers.remove(CircuitBreaker.MONTHLY_LOSS);
        }
        if (cooldownUntil != null && !now.isBefore(cooldownUntil)) {
            cooldownUntil = null;
            breakers.remove(CircuitBreaker.CONSECUTIVE_LOSSES);
            breakers.remove(CircuitBreaker.DRAWDOWN);
        }

        return new RiskState(s.initialCapital(), s.capital(), s.peakCapital(), s.realizedPnl(), sessionDate,
            tradesToday, dailyPnl, currentMonth, tradesThisMonth, monthlyPnl, s.consecutiveLosses(),
            s.totalTrades(), breakers, cooldownUntil);
    }

    // ── gate ──────────────────────────────────────────────────────────────────

    public static RiskCheckResult canTrade(RiskState state, Instant now, ZoneId zone, RiskLimits limits) {
        RiskState s = refresh(state, now, zone);
        for (CircuitBreaker breaker : CircuitBreaker.values()) {
            if (s.isTripped(breaker)) {
                return RiskCheckResult.breaker(breaker, currentValue(s, breaker), threshold(limits, breaker));
            }
        }
        if (s.cooldownUntil() != null && now.isBefore(s.cooldownUntil())) {
            double minutes = Duration.between(now, s.cooldownUntil()).toSeconds() / 60.0;
            return RiskCheckResult.cooldown(minutes, s.cooldownUntil().toString());
        }
        return RiskCheckResult.allow();
    }

    // ── trade close ───────────────────────────────────────────────────────────

    /**
     * Applies one realized pnl: capital, peak and counters first, then every breaker is
     * re-evaluated independently.
     */
    public static CloseTransition recordClose(RiskState state, double pnl, Instant closedAt, ZoneId zone,
                                              RiskLimits limits) {
        RiskState s = refresh(state, closedAt, zone);

        double capital = s.capital() + pnl;
        RiskState updated = new RiskState(
            s.initialCapital(),
            capital,
            Math.max(s.peakCapital(), capital),
            s.realizedPnl() + pnl,
            s.sessionDate(),
            s.tradesToday() + 1,
            s.dailyPnl() + pnl,
            s.month(),
            s.tradesThisMonth() + 1,
            s.monthlyPnl() + pnl,
            pnl < 0 ? s.consecutiveLosses() + 1 : 0,
            s.totalTrades() + 1,
            s.breakers(),
            s.cooldownUntil());

        EnumSet<CircuitBreaker> breakers = copy(updated.breakers());
        List<RiskCheckResult> tripped = new ArrayList<>();
        List<CircuitBreaker> newlyTripped = new ArrayList<>();
        for (CircuitBreaker breaker : CircuitBreaker.values()) {
            double value = currentValue(updated, breaker);
            double threshold = threshold(limits, breaker);
            if (value >= threshold) {
                tripped.add(RiskCheckResult.breaker(breaker, value, threshold));
                if (breakers.add(breaker)) newlyTripped.add(breaker);
            }
        }

        Instant cooldownUntil = updated.cooldownUntil();
        if (!tripped.isEmpty()) {
            Instant candidate = closedAt.plus(limits.cooldown());
            cooldownUntil = cooldownUntil == null || candidate.isAfter(cooldownUntil) ? candidate : cooldownUntil;
        }
        return new CloseTransition(updated.withBreakers(breakers, cooldownUntil), tripped, newlyTripped);
    }

    /** Confirmed operator reset: clears every flag, the cooldown, the loss streak and monthly pnl. */
    public static RiskState manualReset(RiskState s) {
        return new RiskState(s.initialCapital(), s.capital(), s.peakCapital(), s.realizedPnl(), s.sessionDate(),
            s.tradesToday(), s.dailyPnl(), s.month(), s.tradesThisMonth(), 0.0, 0, s.totalTrades(),
            Set.of(), null);
    }

    // ── breaker metrics ───────────────────────────────────────────────────────

    public static double currentValue(RiskState s, CircuitBreaker breaker) {
        return switch (breaker) {
            case DAILY_LOSS         -> s.dailyLossPct();
            case CONSECUTIVE_LOSSES -> s.consecutiveLosses();
            case DRAWDOWN           -> s.drawdownPct();
            case DAILY_TRADE_COUNT  -> s.tradesToday();
            case MONTHLY_LOSS       -> s.monthlyLossPct();
        };
    }

    public static double threshold(RiskLimits limits, CircuitBreaker breaker) {
        return switch (breaker) {
            case DAILY_LOSS         -> limits.maxDailyLossPct();
            case CONSECUTIVE_LOSSES -> limits.maxConsecutiveLosses();
            case DRAWDOWN           -> limits.maxDrawdownPct();
            case DAILY_TRADE_COUNT  -> limits.maxDailyTrades();
            case MONTHLY_LOSS       -> limits.maxMonthlyLossPct();
        };
    }

    private static EnumSet<CircuitBreaker> copy(Set<CircuitBreaker> breakers) {
        return breakers.isEmpty() ? EnumSet.noneOf(CircuitBreaker.class) : EnumSet.copyOf(breakers);
    }
}
