package com.cashcow.domain;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Calendar-month helpers shared by calculators and the forecast engine.
 *
 * <p>All spans are inclusive of both the first and the last month, so a span from
 * 2024-01-15 to 2024-12-01 is 12 months.
 */
public final class MonthMath {

    private MonthMath() {}

    public static LocalDate startOfMonth(LocalDate date) {
        return date.withDayOfMonth(1);
    }

    public static LocalDate endOfMonth(LocalDate date) {
        return YearMonth.from(date).atEndOfMonth();
    }

    public static boolean sameMonth(LocalDate a, LocalDate b) {
        return a != null && b != null && YearMonth.from(a).equals(YearMonth.from(b));
    }

    /** Number of calendar months touched by [start, end], at least 1. */
    public static int monthSpanInclusive(LocalDate start, LocalDate end) {
        long months = ChronoUnit.MONTHS.between(YearMonth.from(start), YearMonth.from(end)) + 1;
        return (int) Math.max(1, months);
    }

    /** Whole calendar months from {@code from}'s month to {@code to}'s month; negative if before. */
    public static int monthsElapsed(LocalDate from, LocalDate to) {
        return (int) ChronoUnit.MONTHS.between(YearMonth.from(from), YearMonth.from(to));
    }

    /**
     * Month-start dates from start's month through end's month inclusive.
     * Empty when start is after end.
     */
    public static List<LocalDate> monthStarts(LocalDate start, LocalDate end) {
        List<LocalDate> months = new ArrayList<>();
        YearMonth current = YearMonth.from(start);
        YearMonth last = YearMonth.from(end);
        while (!current.isAfter(last)) {
            months.add(current.atDay(1));
            current = current.plusMonths(1);
        }
        return months;
    }
}
