package com.patterntrader.common.risk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerEvaluatorTest {

    private static final ZoneId UTC = ZoneOffset.UTC;
    private static final Instant T0 = Instant.parse("2026-03-10T09:30:00Z");
    private static final RiskLimits LIMITS = RiskLimits.defaults();

    private static RiskState fresh() {
        return CircuitBreakerEvaluator.initial(1_000_000, T0, UTC);
    }

    private static RiskState close(RiskState s, double pnl, Instant at, RiskLimits limits) {
        return CircuitBreakerEvaluator.recordClose(s, pnl, at, UTC, limits).state();
    }

    @Test
    @DisplayName("fresh account can trade")
    void freshState() {
        RiskCheckResult r = CircuitBreakerEvaluator.canTrade(fresh(), T0, UTC, LIMITS);
        assertTrue(r.allowed());
        assertNull(r.breaker());
    }

    @Test
    @DisplayName("three −15,000 closes against a 3% daily limit → daily_loss")
    void dailyLossExample() {
        RiskLimits limits = new RiskLimits(3.0, 5, 10.0, 10, 5.0, Duration.ofMinutes(60), 2, 10.0, 5.0);
        RiskState s = fresh();
        for (int i = 0; i < 3; i++) s = close(s, -15_000, T0.plusSeconds(60L * i), limits);

        RiskCheckResult r = CircuitBreakerEvaluator.canTrade(s, T0.plusSeconds(600), UTC, limits);
        assertFalse(r.allowed());
        assertEquals("daily_loss", r.reason());
        assertEquals(CircuitBreaker.DAILY_LOSS, r.breaker());
        assertEquals(4.5, r.currentValue(), 1e-9);
        assertEquals(3.0, r.threshold(), 1e-9);
    }

    @Test
    @DisplayName("capital always equals initial capital plus realized pnl")
    void capitalInvariant() {
        RiskState s = fresh();
        double[] pnls = {2_500, -1_200, 700.5, -3_000, 150};
        for (int i = 0; i < pnls.length; i++) s = close(s, pnls[i], T0.plusSeconds(i), LIMITS);
        assertEquals(s.initialCapital() + s.realizedPnl(), s.capital(), 1e-6);
        assertEquals(5, s.totalTrades());
        assertEquals(1_002_500, s.peakCapital(), 1e-6);
    }

    @Nested
    @DisplayName("consecutive losses")
    class ConsecutiveLosses {

        @Test
        @DisplayName("trips at the limit and starts the cooldown")
        void tripsAtLimit() {
            RiskState s = fresh();
            for (int i = 0; i < 5; i++) s = close(s, -100, T0.plusSeconds(i), LIMITS);

            assertTrue(s.isTripped(CircuitBreaker.CONSECUTIVE_LOSSES));
            assertEquals(T0.plusSeconds(4).plus(Duration.ofMinutes(60)), s.cooldownUntil());
            assertEquals("consecutive_losses",
                CircuitBreakerEvaluator.canTrade(s, T0.plusSeconds(10), UTC, LIMITS).reason());
        }

        @Test
        @DisplayName("a win resets the streak")
        void winResets() {
            RiskState s = fresh();
            for (int i = 0; i < 4; i++) s = close(s, -100, T0.plusSeconds(i), LIMITS);
            s = close(s, 50, T0.plusSeconds(5), LIMITS);
            assertEquals(0, s.consecutiveLosses());
            assertTrue(CircuitBreakerEvaluator.canTrade(s, T0.plusSeconds(6), UTC, LIMITS).allowed());
        }

        @Test
        @DisplayName("clears once the cooldown has elapsed")
        void clearsAfterCooldown() {
            RiskState s = fresh();
            for (int i = 0; i < 5; i++) s = close(s, -100, T0.plusSeconds(i), LIMITS);

            Instant later = s.cooldownUntil().plusSeconds(1);
            assertTrue(CircuitBreakerEvaluator.canTrade(s, later, UTC, LIMITS).allowed());
            RiskState refreshed = CircuitBreakerEvaluator.refresh(s, later, UTC);
            assertFalse(refreshed.isTripped(CircuitBreaker.CONSECUTIVE_LOSSES));
            assertNull(refreshed.cooldownUntil());
        }
    }

    @Test
    @DisplayName("drawdown from the peak trips the drawdown breaker")
    void drawdown() {
        RiskState s = fresh();
        s = close(s, 100_000, T0, LIMITS);                          // peak 1.1M
        s = CircuitBreakerEvaluator.refresh(s, T0.plus(Duration.ofDays(1)), UTC);
        s = close(s, -115_000, T0.plus(Duration.ofDays(1)), LIMITS); // 985k, dd 10.45%

        assertTrue(s.isTripped(CircuitBreaker.DRAWDOWN));
        assertEquals(1_100_000, s.peakCapital(), 1e-6);
    }

    @Test
    @DisplayName("daily trade count trips at the configured maximum")
    void dailyTradeCount() {
        RiskState s = fresh();
        for (int i = 0; i < 10; i++) s = close(s, i % 2 == 0 ? 10 : -10, T0.plusSeconds(i), LIMITS);
        RiskCheckResult r = CircuitBreakerEvaluator.canTrade(s, T0.plusSeconds(20), UTC, LIMITS);
        assertEquals(CircuitBreaker.DAILY_TRADE_COUNT, r.breaker());
    }

    @Nested
    @DisplayName("rollover")
    class Rollover {

        @Test
        @DisplayName("next session clears daily breakers and counters")
        void dateRollover() {
            RiskLimits limits = new RiskLimits(3.0, 5, 10.0, 10, 5.0, Duration.ZERO, 2, 10.0, 5.0);
            RiskState s = fresh();
            s = close(s, -35_000, T0, limits);
            assertTrue(s.isTripped(CircuitBreaker.DAILY_LOSS));

            Instant nextDay = T0.plus(Duration.ofDays(1));
            assertTrue(CircuitBreakerEvaluator.canTrade(s, nextDay, UTC, limits).allowed());
            RiskState refreshed = CircuitBreakerEvaluator.refresh(s, nextDay, UTC);
            assertEquals(0, refreshed.tradesToday());
            assertEquals(0.0, refreshed.dailyPnl(), 1e-9);
            assertEquals(-35_000, refreshed.monthlyPnl(), 1e-9);
        }

        @Test
        @DisplayName("new month clears the monthly breaker")
        void monthRollover() {
            RiskLimits limits = new RiskLimits(50.0, 50, 50.0, 100, 5.0, Duration.ZERO, 2, 10.0, 5.0);
            RiskState s = fresh();
            for (int d = 0; d < 3; d++) {
                s = close(s, -20_000, T0.plus(Duration.ofDays(d)), limits);
            }
            assertTrue(s.isTripped(CircuitBreaker.MONTHLY_LOSS));
            assertFalse(CircuitBreakerEvaluator.canTrade(s, T0.plus(Duration.ofDays(5)), UTC, limits).allowed());

            Instant april = Instant.parse("2026-04-01T09:30:00Z");
            RiskState refreshed = CircuitBreakerEvaluator.refresh(s, april, UTC);
            assertFalse(refreshed.isTripped(CircuitBreaker.MONTHLY_LOSS));
            assertEquals(0.0, refreshed.monthlyPnl(), 1e-9);
            assertTrue(CircuitBreakerEvaluator.canTrade(s, april, UTC, limits).allowed());
        }
    }

    @Test
    @DisplayName("manual reset clears every flag and the cooldown")
    void manualReset() {
        RiskState s = fresh();
        for (int i = 0; i < 5; i++) s = close(s, -100, T0.plusSeconds(i), LIMITS);
        RiskState reset = CircuitBreakerEvaluator.manualReset(s);

        assertTrue(reset.breakers().isEmpty());
        assertNull(reset.cooldownUntil());
        assertEquals(0, reset.consecutiveLosses());
        assertEquals(s.capital(), reset.capital(), 1e-9);
        assertTrue(CircuitBreakerEvaluator.canTrade(reset, T0.plusSeconds(10), UTC, LIMITS).allowed());
    }

    @Test
    @DisplayName("a copy of the persisted fields answers canTrade identically")
    void reloadFidelity() {
        RiskState s = fresh();
        for (int i = 0; i < 5; i++) s = close(s, -100, T0.plusSeconds(i), LIMITS);

        RiskState reloaded = new RiskState(s.initialCapital(), s.capital(), s.peakCapital(), s.realizedPnl(),
            s.sessionDate(), s.tradesToday(), s.dailyPnl(), s.month(), s.tradesThisMonth(), s.monthlyPnl(),
            s.consecutiveLosses(), s.totalTrades(), Set.copyOf(s.breakers()), s.cooldownUntil());

        for (Instant at : new Instant[] {T0.plusSeconds(30), s.cooldownUntil(), T0.plus(Duration.ofDays(2))}) {
            assertEquals(CircuitBreakerEvaluator.canTrade(s, at, UTC, LIMITS),
                         CircuitBreakerEvaluator.canTrade(reloaded, at, UTC, LIMITS));
        }
    }
}
