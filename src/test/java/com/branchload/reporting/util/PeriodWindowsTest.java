package com.branchload.reporting.util;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * PeriodWindows Test - Monday-start chunking and month helpers
 */
class PeriodWindowsTest {

    @Test
    void shouldPartitionMonthIntoMondayStartWeeks() {
        // March 2025 starts on a Saturday and ends on a Monday
        List<PeriodWindows.Window> weeks = PeriodWindows.weekChunks(YearMonth.of(2025, 3));

        assertThat(weeks).first().isEqualTo(new PeriodWindows.Window(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 2)));
        assertThat(weeks).last().isEqualTo(new PeriodWindows.Window(LocalDate.of(2025, 3, 31), LocalDate.of(2025, 3, 31)));
        assertThat(weeks).hasSize(6);

        List<LocalDate> covered = new ArrayList<>();
        weeks.forEach(w -> covered.addAll(w.days()));
        assertThat(covered).containsExactlyElementsOf(PeriodWindows.monthDays(YearMonth.of(2025, 3)));
        assertThat(weeks.subList(1, weeks.size()))
                .allMatch(w -> w.start().getDayOfWeek() == DayOfWeek.MONDAY);
    }

    @Test
    void shouldHandleEmptyInput() {
        assertThat(PeriodWindows.weekChunks(List.of())).isEmpty();
        assertThat(PeriodWindows.dateRange(LocalDate.of(2025, 3, 2), LocalDate.of(2025, 3, 1))).isEmpty();
    }

    @Test
    void shouldBuildTrailingWeeksEndingWithCutoffWeek() {
        List<PeriodWindows.Window> weeks = PeriodWindows.lastWeeks(LocalDate.of(2025, 3, 12), 8);

        assertThat(weeks).hasSize(8);
        assertThat(weeks.get(7).start()).isEqualTo(LocalDate.of(2025, 3, 10));
        assertThat(weeks.get(7).end()).isEqualTo(LocalDate.of(2025, 3, 16));
        assertThat(weeks.get(0).start()).isEqualTo(LocalDate.of(2025, 1, 20));
    }

    @Test
    void shouldCoverMonthWithWeekStarts() {
        assertThat(PeriodWindows.weekStartsCovering(YearMonth.of(2025, 3)))
                .first().isEqualTo(LocalDate.of(2025, 2, 24));
        assertThat(PeriodWindows.weekStartsCovering(YearMonth.of(2025, 3)))
                .last().isEqualTo(LocalDate.of(2025, 3, 31));
        assertThat(PeriodWindows.weekStartMonday(LocalDate.of(2025, 3, 9))).isEqualTo(LocalDate.of(2025, 3, 3));
    }

    @Test
    void shouldParseMonthOrReject() {
        assertThat(PeriodWindows.parseMonth(" 2025-03 ")).isEqualTo(YearMonth.of(2025, 3));
        assertThatThrownBy(() -> PeriodWindows.parseMonth("03/2025")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PeriodWindows.parseMonth(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
