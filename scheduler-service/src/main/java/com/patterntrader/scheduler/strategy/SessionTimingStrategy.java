package com.patterntrader.scheduler.strategy;

import com.patterntrader.common.trade.TradingCalendar;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * When the next daily session run is due.
 *
 * <p>A run is due at {@code sessionTime} in the exchange zone on every trading day.
 * Weekends are skipped; a run that would land on a Saturday moves to Monday.
 */
public final class SessionTimingStrategy {

    private SessionTimingStrategy() {}

    /** First session run strictly after {@code now}. */
    public static ZonedDateTime nextRun(Instant now, ZoneId zone, LocalTime sessionTime) {
        ZonedDateTime local = now.atZone(zone);
        LocalDate day = local.toLocalDate();
        if (!local.toLocalTime().isBefore(sessionTime)) {
            day = day.plusDays(1);
        }
        while (!TradingCalendar.isTradingDay(day)) {
            day = day.plusDays(1);
        }
        return ZonedDateTime.of(day, sessionTime, zone);
    }

    public static Duration delayUntilNextRun(Instant now, ZoneId zone, LocalTime sessionTime) {
        return Duration.between(now, nextRun(now, zone, sessionTime).toInstant());
    }

    /** Retry soon after a failure, but never past the next regular run. */
    public static Duration retryDelay(Instant now, ZoneId zone, LocalTime sessionTime, Duration retryInterval) {
        Duration regular = delayUntilNextRun(now, zone, sessionTime);
        return regular.compareTo(retryInterval) < 0 ? regular : retryInterval;
    }
}
