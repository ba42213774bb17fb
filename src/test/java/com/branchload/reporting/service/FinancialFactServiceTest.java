package com.branchload.reporting.service;

import com.branchload.reporting.entity.Branch;
import com.branchload.reporting.entity.DailyMetricFact;
import com.branchload.reporting.repository.DailyMetricRepository;
import com.branchload.reporting.repository.MonthlyPlanRepository;
import com.branchload.reporting.test.IntegrationTestSupport;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * FinancialFactService Test - upsert semantics and directory reads
 */
@Slf4j
class FinancialFactServiceTest extends IntegrationTestSupport {

    private static final String BRANCH = "FFS";

    @Autowired private FinancialFactService service;
    @Autowired private DailyMetricRepository dailyMetricRepository;
    @Autowired private MonthlyPlanRepository monthlyPlanRepository;

    @Test
    void shouldOverwriteFactOnRepeatedUpsert() {
        LocalDate day = LocalDate.of(2025, 4, 2);
        service.upsertDailyFact(" ffs ", "revenue_total", day, 100.0);
        service.upsertDailyFact(BRANCH, "revenue_total", day, 150.0);
        service.upsertDailyFact(BRANCH, "revenue_cash", day, null);

        Map<String, Map<LocalDate, Double>> values = dailyMetricRepository.findValues(
                BRANCH, List.of("revenue_total", "revenue_cash"), day, day);

        assertThat(values.get("revenue_total")).containsExactly(entry(day, 150.0));
        assertThat(values).doesNotContainKey("revenue_cash");
    }

    @Test
    void shouldRejectIncompleteFacts() {
        assertThatThrownBy(() -> service.upsertDailyFacts(List.of(DailyMetricFact.builder()
                .branchCode(BRANCH).metricCode("revenue_total").value(1.0).build())))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.upsertDailyFact(" ", "revenue_total", LocalDate.of(2025, 4, 1), 1.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.upsertPlan(BRANCH, "April", "revenue_total", 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldUpsertPlansPerMonth() {
        service.upsertPlan(BRANCH, "2025-04", "revenue_open_space", 1000.0);
        service.upsertPlan("ffs", "2025-04", "revenue_open_space", 1200.0);

        assertThat(monthlyPlanRepository.findByMonth(BRANCH, YearMonth.of(2025, 4)))
                .containsEntry("revenue_open_space", 1200.0);
        assertThat(monthlyPlanRepository.findByMonth(BRANCH, YearMonth.of(2025, 5))).isEmpty();
    }

    @Test
    void shouldListBranchesAndMonths() {
        service.upsertDailyFact(BRANCH, "revenue_total", LocalDate.of(2025, 2, 10), 10.0);
        service.upsertDailyFact(BRANCH, "revenue_total", LocalDate.of(2025, 4, 10), 10.0);

        assertThat(service.listBranches()).extracting(Branch::getCode).contains("MAIN", BRANCH);
        assertThat(service.branch("main").getName()).isEqualTo("Main branch");
        assertThat(service.listMonths(BRANCH)).containsSubsequence(YearMonth.of(2025, 4), YearMonth.of(2025, 2));
    }

    @Test
    void shouldExposeSeededCatalog() {
        assertThat(service.metricCatalog()).hasSize(13);
        assertThat(service.metricCatalog().get(0).getCode()).isEqualTo("revenue_open_space");
        assertThat(service.metricCatalog().get(12).getCode()).isEqualTo("revenue_desserts");
        assertThat(service.metricLabel("revenue_open_space")).isEqualTo("Open space rent");
        assertThat(service.metricLabel("unknown_metric")).isEqualTo("unknown_metric");
        assertThat(FinancialFactService.normalizeBranchCode(" main ")).isEqualTo("MAIN");
    }
}
