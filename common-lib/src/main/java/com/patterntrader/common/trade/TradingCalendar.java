package com.patterntrader.common.trade;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Weekday trading calendar. Exchange holidays are not modelled. */
public final class TradingCalendar {

    private TradingCalendar() {}

    public static boolean isTradingDay(LocalDate date) {
        DayOfWeek d = date.getDayOfWeek();
        return d != DayOfWeek.SATURDAY && d != DayOfWeek.SUNDAY;
    }

    public static LocalDate addTradingDays(LocalDate start, int days) {
        LocalDate date = start;
        int added = 0;
        while (added < days) {
            date = date.plusDays(1);
            if (isTradingDay(date)) added++;
        }
        return date;
    }

    /** Trading days strictly after {@code from} up to and including {@code to}, oldest first. */
    public static List<LocalDate> tradingDaysBetween(LocalDate from, LocalDate to) {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate d = from.plusDays(1); !d.isAfter(to); d = d.plusDays(1)) {
            if (isTradingDay(d)) days.add(d);
        }
        return days;
    }
}
