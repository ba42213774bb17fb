package com.branchload.reporting.service;

import com.branchload.reporting.dto.report.YearMetricRow;
import com.branchload.reporting.dto.report.YearSummary;
import com.branchload.reporting.test.IntegrationTestSupport;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.*;

/**
 * YearSummaryService Test - monthly facts and plans across years
 */
@Slf4j
class YearSummaryServiceTest extends IntegrationTestSupport {

    private static final String BRANCH = "YRS";

    @Autowired private YearSummaryService yearSummaryService;
    @Autowired private FinancialFactService financialFactService;

    @Test
    void shouldSumFactsPerMonthAndSpanToCurrentYear() {
        financialFactService.upsertDailyFact(BRANCH, "revenue_total", LocalDate.of(2024, 5, 1), 100.0);
        financialFactService.upsertDailyFact(BRANCH, "revenue_total", LocalDate.of(2024, 5, 2), 50.0);
        financialFactService.upsertDailyFact(BRANCH, "revenue_open_space", LocalDate.of(2024, 6, 3), 70.0);
        financialFactService.upsertPlan(BRANCH, "2024-05", "revenue_total", 200.0);

        YearSummary summary = yearSummaryService.build("yrs");
        int currentYear = YearMonth.now(ZoneId.of("Europe/Moscow")).getYear();

        assertThat(summary.getBranch().getCode()).isEqualTo(BRANCH);
        assertThat(summary.getPlanYear()).isEqualTo(currentYear);
        assertThat(summary.getYears()).startsWith(2024).endsWith(currentYear);
        assertThat(summary.getMonths()).hasSize(summary.getYears().size() * 12);
        assertThat(summary.getMetrics()).hasSize(8);

        YearMetricRow total = row(summary, "revenue_total");
        assertThat(total.getFact()).containsEntry(YearMonth.of(2024, 5), 150.0);
        assertThat(total.getPlan()).containsEntry(YearMonth.of(2024, 5), 200.0);
        assertThat(total.getLabel()).isEqualTo("revenue_total");

        YearMetricRow openSpace = row(summary, "revenue_open_space");
        assertThat(openSpace.getFact()).containsOnlyKeys(YearMonth.of(2024, 6));
        assertThat(openSpace.getLabel()).isEqualTo("Open space rent");
    }

    @Test
    void shouldCoverCurrentYearForBranchWithoutData() {
        YearSummary summary = yearSummaryService.build("empty-branch");
        int currentYear = YearMonth.now(ZoneId.of("Europe/Moscow")).getYear();

        assertThat(summary.getYears()).containsExactly(currentYear);
        assertThat(summary.getMonths()).hasSize(12);
        assertThat(summary.getMetrics()).allSatisfy(r -> assertThat(r.getFact()).isEmpty());
    }

    private static YearMetricRow row(YearSummary summary, String code) {
        return summary.getMetrics().stream().filter(r -> r.getCode().equals(code)).findFirst().orElseThrow();
    }
}
