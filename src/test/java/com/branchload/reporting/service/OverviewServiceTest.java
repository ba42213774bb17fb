package com.branchload.reporting.service;

import com.branchload.reporting.dto.report.DriverItem;
import com.branchload.reporting.dto.report.OverviewAlert;
import com.branchload.reporting.dto.report.OverviewReport;
import com.branchload.reporting.entity.DailyMetricFact;
import com.branchload.reporting.entity.enums.CheckStatus;
import com.branchload.reporting.test.IntegrationTestSupport;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * OverviewService Test - month to date for March 2025 against March 2024 and eight trailing weeks
 */
@Slf4j
class OverviewServiceTest extends IntegrationTestSupport {

    private static final String BRANCH = "OVW";

    @Autowired private OverviewService overviewService;
    @Autowired private FinancialFactService financialFactService;

    private final List<DailyMetricFact> facts = new ArrayList<>();

    @BeforeEach
    void setUp() {
        // Five full weeks before the month: busy but well paid
        for (LocalDate day = LocalDate.of(2025, 1, 20); !day.isAfter(LocalDate.of(2025, 2, 23)); day = day.plusDays(1)) {
            fact("revenue_open_space", day, 1000.0);
            fact("load_percent", day, 50.0);
        }

        for (int d = 1; d <= 10; d++) {
            LocalDate day = LocalDate.of(2025, 3, d);
            fact("revenue_total", day, 1000.0);
            fact("revenue_open_space", day, 100.0);
            fact("load_percent", day, 90.0);
            fact("revenue_open_space", LocalDate.of(2024, 3, d), 50.0);
        }

        fact("revenue_lab", LocalDate.of(2025, 3, 1), 300.0);
        fact("revenue_lab", LocalDate.of(2024, 3, 1), 100.0);
        fact("revenue_cabinets", LocalDate.of(2025, 3, 1), 10.0);
        fact("revenue_cabinets", LocalDate.of(2024, 3, 1), 20.0);
        fact("revenue_retail", LocalDate.of(2025, 3, 1), 50.0);
        fact("revenue_retail", LocalDate.of(2024, 3, 1), 0.0);

        fact("cash_balance_end_day", LocalDate.of(2025, 3, 1), 1000.0);
        fact("revenue_cash", LocalDate.of(2025, 3, 2), 500.0);
        fact("withdrawals_total", LocalDate.of(2025, 3, 2), 200.0);
        fact("cash_balance_end_day", LocalDate.of(2025, 3, 2), 1290.0);
        fact("cash_balance_end_day", LocalDate.of(2025, 3, 3), 5000.0);

        fact("sold_food_total", LocalDate.of(2025, 3, 1), 80.0);
        fact("written_off_food_total", LocalDate.of(2025, 3, 1), 20.0);

        financialFactService.upsertDailyFacts(facts);
    }

    @Test
    void shouldCutMonthToDateAtLastFilledDay() {
        OverviewReport report = overviewService.build(BRANCH, "2025-03");

        assertThat(report.getCutoffDay()).isEqualTo(10);
        assertThat(report.getFilledDays()).isEqualTo(10);
        assertThat(report.getDaysInMonth()).isEqualTo(31);
        assertThat(report.getRangeLabel()).isEqualTo("1–10");
        assertThat(report.getCurrent()).containsEntry("revenue_total", 10000.0);
        assertThat(report.getCurrent()).containsEntry("revenue_open_space", 1000.0);
        assertThat(report.getYoy()).containsEntry("revenue_open_space", 500.0);
        assertThat(report.getYoyDelta().get("revenue_total").getDelta()).isNull();
    }

    @Test
    void shouldRankPositiveDrivers() {
        List<DriverItem> drivers = overviewService.build(BRANCH, "2025-03").getDrivers();

        assertThat(drivers).extracting(DriverItem::getCode).containsExactly("revenue_open_space", "revenue_lab");
        assertThat(drivers.get(0).getLabel()).isEqualTo("Open space");
        assertThat(drivers.get(0).getDelta()).isEqualTo(500.0);
        assertThat(drivers.get(0).getPct()).isCloseTo(100.0, within(1e-9));
        assertThat(drivers.get(1).getPct()).isCloseTo(200.0, within(1e-9));
    }

    @Test
    void shouldAverageTrailingWeeks() {
        OverviewReport report = overviewService.build(BRANCH, "2025-03");

        assertThat(report.getWeeks()).hasSize(8);
        assertThat(report.getWeeks().get(0).start()).isEqualTo(LocalDate.of(2025, 1, 20));
        assertThat(report.getWeeks().get(7).start()).isEqualTo(LocalDate.of(2025, 3, 10));
        assertThat(report.getWeeklyValues().get("revenue_open_space").get(5)).isEqualTo(200.0);
        assertThat(report.getAverages().get("revenue_open_space")).isCloseTo(4500.0, within(1e-6));
        assertThat(report.getAverages().get("load_percent")).isCloseTo(65.0, within(1e-6));
        assertThat(report.getAverages().get("coffee_revenue_total")).isNull();
    }

    @Test
    void shouldRaiseAlertsAndChecks() {
        OverviewReport report = overviewService.build(BRANCH, "2025-03");

        assertThat(report.getCashControl()).hasSize(1);
        assertThat(report.getCashControl().get(0).getDate()).isEqualTo(LocalDate.of(2025, 3, 3));
        assertThat(report.getCashControl().get(0).getDiff()).isEqualTo(3710.0);

        assertThat(report.getAlerts()).extracting(OverviewAlert::getType)
                .containsExactly(OverviewService.CHECK_CASH, OverviewService.ALERT_WRITEOFF, OverviewService.CHECK_LOAD_OPEN);
        assertThat(report.getAlerts().get(1).getRate()).isCloseTo(0.2, within(1e-9));

        assertThat(report.check(OverviewService.CHECK_CASH).getStatus()).isEqualTo(CheckStatus.ALERT);
        assertThat(report.check(OverviewService.CHECK_CASH).getMaxDiff()).isEqualTo(3710.0);
        assertThat(report.check(OverviewService.CHECK_LOAD_OPEN).getStatus()).isEqualTo(CheckStatus.ALERT);
        assertThat(report.check(OverviewService.CHECK_LOAD_COFFEE).getStatus()).isEqualTo(CheckStatus.NO_DATA);

        assertThat(report.getCoefficients().get("writeoff_rate")).isCloseTo(0.2, within(1e-9));
        assertThat(report.getCoefficients().get("lab_to_open_space_ratio")).isCloseTo(0.3, within(1e-9));
        assertThat(report.getCoefficients().get("avg_check")).isNull();
    }

    @Test
    void shouldReportNoDataForEmptyMonth() {
        OverviewReport report = overviewService.build(BRANCH, "2025-06");

        assertThat(report.getCutoffDay()).isZero();
        assertThat(report.getRangeLabel()).isEmpty();
        assertThat(report.getCurrent()).isEmpty();
        assertThat(report.getAlerts()).isEmpty();
        assertThat(report.getDrivers()).isEmpty();
        assertThat(report.check(OverviewService.CHECK_CASH).getStatus()).isEqualTo(CheckStatus.NO_DATA);
        assertThat(report.check(OverviewService.CHECK_LOAD_OPEN).getStatus()).isEqualTo(CheckStatus.NO_DATA);
    }

    @Test
    void shouldMapDriverLabels() {
        assertThat(OverviewService.driverLabel("revenue_salon")).isEqualTo("Salon services");
        assertThat(OverviewService.driverLabel("revenue_other")).isEqualTo("revenue_other");
    }

    private void fact(String metric, LocalDate date, double value) {
        facts.add(DailyMetricFact.builder().branchCode(BRANCH).metricCode(metric).date(date).value(value).build());
    }
}
