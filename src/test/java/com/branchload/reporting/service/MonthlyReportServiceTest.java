package com.branchload.reporting.service;

import com.branchload.reporting.dto.report.MonthlyMetricReport;
import com.branchload.reporting.dto.report.MonthlyMetricRow;
import com.branchload.reporting.test.IntegrationTestSupport;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

/**
 * MonthlyReportService Test - weekly roll-ups, plan and forecast for March 2025
 */
@Slf4j
class MonthlyReportServiceTest extends IntegrationTestSupport {

    private static final String BRANCH = "MRT";

    @Autowired private MonthlyReportService monthlyReportService;
    @Autowired private FinancialFactService financialFactService;

    @BeforeEach
    void setUp() {
        fact("revenue_open_space", LocalDate.of(2025, 2, 3), 100.0);
        fact("revenue_open_space", LocalDate.of(2025, 2, 10), 200.0);
        fact("revenue_open_space", LocalDate.of(2025, 3, 1), 300.0);
        fact("revenue_open_space", LocalDate.of(2025, 3, 3), 100.0);
        fact("revenue_open_space", LocalDate.of(2025, 3, 4), 200.0);

        fact("load_percent", LocalDate.of(2025, 3, 3), 50.0);
        fact("load_percent", LocalDate.of(2025, 3, 4), 70.0);

        fact("coffee_revenue_total", LocalDate.of(2025, 3, 3), 500.0);
        fact("coffee_revenue_total", LocalDate.of(2025, 3, 4), 300.0);
        fact("coffee_checks", LocalDate.of(2025, 3, 3), 5.0);
        fact("coffee_checks", LocalDate.of(2025, 3, 4), 0.0);

        financialFactService.upsertPlan(BRANCH, "2025-03", "revenue_open_space", 1000.0);
        financialFactService.upsertPlan(BRANCH, "2025-03", "load_percent", 80.0);
    }

    @Test
    void shouldLayOutWeeksOfBothMonths() {
        MonthlyMetricReport report = monthlyReportService.build("mrt", "2025-03");

        assertThat(report.getMonth()).isEqualTo("2025-03");
        assertThat(report.getBranch().getCode()).isEqualTo(BRANCH);
        assertThat(report.getDays()).hasSize(31);
        assertThat(report.getWeeks()).hasSize(11);
        assertThat(report.getWeekLabels()).hasSize(12);
        assertThat(report.getWeekLabels().get(0)).isEqualTo("W-5 (01.02-02.02)");
        assertThat(report.getWeekLabels().get(5)).isEqualTo("Prev month total");
        assertThat(report.getWeekLabels().get(6)).isEqualTo("W1 (01.03-02.03)");
        assertThat(report.getWeekLabels().get(11)).isEqualTo("W6 (31.03-31.03)");
    }

    @Test
    void shouldSumAdditiveMetricWithPlanAndForecast() {
        MonthlyMetricRow row = monthlyReportService.build(BRANCH, "2025-03").metric("revenue_open_space");

        assertThat(row.getWeekTotals()).containsExactlyElementsOf(
                Arrays.asList(null, 100.0, 200.0, null, null, 300.0, 300.0, 300.0, null, null, null, null));
        assertThat(row.getPrevMonthTotal()).isEqualTo(300.0);
        assertThat(row.getMonthTotal()).isEqualTo(600.0);
        assertThat(row.getForecast()).isEqualTo(6200.0);
        assertThat(row.getPlan()).isEqualTo(1000.0);
        assertThat(row.getPlanDelta()).isEqualTo(-400.0);
        assertThat(row.getPlanPct()).isCloseTo(60.0, within(1e-9));
        assertThat(row.getForecastPct()).isCloseTo(620.0, within(1e-9));
        assertThat(row.getValues()).hasSize(31);
        assertThat(row.getValues().get(0)).isEqualTo(300.0);
        assertThat(row.getValues().get(1)).isNull();
    }

    @Test
    void shouldAverageRateMetricAndIgnorePlanWhenDisabled() {
        MonthlyMetricRow row = monthlyReportService.build(BRANCH, "2025-03").metric("load_percent");

        assertThat(row.getMonthTotal()).isEqualTo(60.0);
        assertThat(row.getForecast()).isEqualTo(60.0);
        assertThat(row.getWeekTotals().get(7)).isEqualTo(60.0);
        assertThat(row.getPrevMonthTotal()).isNull();
        assertThat(row.isPlanEnabled()).isFalse();
        assertThat(row.getPlan()).isNull();
        assertThat(row.getPlanPct()).isNull();
    }

    @Test
    void shouldDeriveAverageCheckFromPeriodTotals() {
        MonthlyMetricRow row = monthlyReportService.build(BRANCH, "2025-03").metric("avg_check");

        assertThat(row.getValues().get(2)).isEqualTo(100.0);
        assertThat(row.getValues().get(3)).isNull();
        assertThat(row.getMonthTotal()).isEqualTo(160.0);
        assertThat(row.getWeekTotals().get(7)).isEqualTo(160.0);
        assertThat(row.getForecast()).isEqualTo(160.0);
    }

    @Test
    void shouldLeaveEmptyMonthWithoutForecast() {
        MonthlyMetricRow row = monthlyReportService.build(BRANCH, "2025-07").metric("revenue_open_space");

        assertThat(row.getMonthTotal()).isNull();
        assertThat(row.getForecast()).isNull();
        assertThat(row.getPlanPct()).isNull();
    }

    @Test
    void shouldRejectMalformedMonth() {
        assertThatThrownBy(() -> monthlyReportService.build(BRANCH, "2025/03"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void fact(String metric, LocalDate date, double value) {
        financialFactService.upsertDailyFact(BRANCH, metric, date, value);
    }
}
