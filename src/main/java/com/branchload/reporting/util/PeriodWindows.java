package com.branchload.reporting.util;

import lombok.experimental.UtilityClass;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Calendar windowing helpers: day ranges, Monday-start week chunks, month bounds.
 */
@UtilityClass
public class PeriodWindows {

    /**
     * Inclusive window of days.
     */
    public record Window(LocalDate start, LocalDate end) {

        public List<LocalDate> days() {
            return dateRange(start, end);
        }

        public boolean contains(LocalDate day) {
            return !day.isBefore(start) && !day.isAfter(end);
        }
    }

    /**
     * All days from start to end, both inclusive. Empty when end precedes start.
     */
    public List<LocalDate> dateRange(LocalDate start, LocalDate end) {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
            days.add(day);
        }
        return days;
    }

    /**
     * Splits consecutive days into chunks closed on every Sunday and on the last day.
     */
    public List<Window> weekChunks(List<LocalDate> days) {
        List<Window> weeks = new ArrayList<>();
        if (days == null || days.isEmpty()) {
            return weeks;
        }
        LocalDate chunkStart = days.get(0);
        for (int i = 0; i < days.size(); i++) {
            LocalDate day = days.get(i);
            boolean weekEnd = day.getDayOfWeek() == DayOfWeek.SUNDAY || i == days.size() - 1;
            if (weekEnd) {
                weeks.add(new Window(chunkStart, day));
                if (i + 1 < days.size()) {
                    chunkStart = days.get(i + 1);
                }
            }
        }
        return weeks;
    }

    public List<Window> weekChunks(YearMonth month) {
        return weekChunks(monthDays(month));
    }

    public List<LocalDate> monthDays(YearMonth month) {
        return dateRange(month.atDay(1), month.atEndOfMonth());
    }

    public Window monthWindow(YearMonth month) {
        return new Window(month.atDay(1), month.atEndOfMonth());
    }

    public LocalDate weekStartMonday(LocalDate day) {
        return day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    /**
     * The last {@code count} full Monday-start weeks, oldest first, the newest one containing {@code endDate}.
     */
    public List<Window> lastWeeks(LocalDate endDate, int count) {
        LocalDate lastStart = weekStartMonday(endDate);
        List<Window> weeks = new ArrayList<>();
        for (int offset = count - 1; offset >= 0; offset--) {
            LocalDate start = lastStart.minusWeeks(offset);
            weeks.add(new Window(start, start.plusDays(6)));
        }
        return weeks;
    }

    /**
     * Monday week starts covering every day of the month.
     */
    public List<LocalDate> weekStartsCovering(YearMonth month) {
        List<LocalDate> starts = new ArrayList<>();
        for (LocalDate current = weekStartMonday(month.atDay(1));
             !current.isAfter(month.atEndOfMonth());
             current = current.plusWeeks(1)) {
            starts.add(current);
        }
        return starts;
    }

    public YearMonth parseMonth(String value) {
        try {
            return YearMonth.parse(value == null ? "" : value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("month must be in YYYY-MM format: " + value, e);
        }
    }
}
