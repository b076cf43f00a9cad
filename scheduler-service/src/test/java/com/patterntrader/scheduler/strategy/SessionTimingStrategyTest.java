package com.patterntrader.scheduler.strategy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SessionTimingStrategyTest {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");
    private static final LocalTime SESSION = LocalTime.of(15, 45);

    @Nested
    @DisplayName("nextRun")
    class NextRun {

        @Test
        @DisplayName("before the session time runs the same day")
        void sameDay() {
            ZonedDateTime next = SessionTimingStrategy.nextRun(Instant.parse("2026-03-10T04:00:00Z"), IST, SESSION);
            assertEquals(ZonedDateTime.of(LocalDate.of(2026, 3, 10), SESSION, IST), next);
        }

        @Test
        @DisplayName("exactly at the session time moves to the next trading day")
        void atSessionTime() {
            ZonedDateTime next = SessionTimingStrategy.nextRun(Instant.parse("2026-03-10T10:15:00Z"), IST, SESSION);
            assertEquals(LocalDate.of(2026, 3, 11), next.toLocalDate());
        }

        @Test
        @DisplayName("Friday evening rolls over the weekend to Monday")
        void fridayEvening() {
            ZonedDateTime next = SessionTimingStrategy.nextRun(Instant.parse("2026-03-13T12:00:00Z"), IST, SESSION);
            assertEquals(LocalDate.of(2026, 3, 16), next.toLocalDate());
        }

        @Test
        @DisplayName("Saturday morning waits for Monday")
        void saturday() {
            ZonedDateTime next = SessionTimingStrategy.nextRun(Instant.parse("2026-03-14T04:00:00Z"), IST, SESSION);
            assertEquals(ZonedDateTime.of(LocalDate.of(2026, 3, 16), SESSION, IST), next);
        }
    }

    @Test
    void delayIsMeasuredInTheExchangeZone() {
        Duration delay = SessionTimingStrategy.delayUntilNextRun(Instant.parse("2026-03-10T04:00:00Z"), IST, SESSION);
        assertEquals(Duration.ofHours(6).plusMinutes(15), delay);
    }

    @Nested
    @DisplayName("retryDelay")
    class RetryDelay {

        @Test
        void usesRetryIntervalWhenTheNextRunIsFarAway() {
            Duration d = SessionTimingStrategy.retryDelay(Instant.parse("2026-03-10T04:00:00Z"), IST, SESSION,
                                                          Duration.ofMinutes(15));
            assertEquals(Duration.ofMinutes(15), d);
        }

        @Test
        void neverOvershootsTheNextRun() {
            Duration d = SessionTimingStrategy.retryDelay(Instant.parse("2026-03-10T10:05:00Z"), IST, SESSION,
                                                          Duration.ofMinutes(15));
            assertEquals(Duration.ofMinutes(10), d);
        }
    }
}
