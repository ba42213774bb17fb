package com.branchload.reporting.service;

import com.branchload.reporting.analytics.MetricCodes;
import com.branchload.reporting.config.EtlConfig;
import com.branchload.reporting.dto.report.YearMetricRow;
import com.branchload.reporting.dto.report.YearSummary;
import com.branchload.reporting.repository.DailyMetricRepository;
import com.branchload.reporting.repository.MonthlyPlanRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Year Summary Service - monthly fact totals and plans of the headline revenue lines
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class YearSummaryService {

    private final FinancialFactService financialFactService;
    private final DailyMetricRepository dailyMetricRepository;
    private final MonthlyPlanRepository monthlyPlanRepository;
    private final EtlConfig etlConfig;
    private final Clock clock;

    /**
     * Years run from the earliest month on record to the latest, always including the current year.
     */
    public YearSummary build(String branchCode) {
        String code = FinancialFactService.normalizeBranchCode(branchCode);
        int currentYear = YearMonth.now(clock.withZone(etlConfig.getZoneId())).getYear();

        Map<String, Map<YearMonth, Double>> facts = dailyMetricRepository.findMonthlyTotals(code, MetricCodes.YEAR_SUMMARY_CODES);
        Map<String, Map<YearMonth, Double>> plans = monthlyPlanRepository.findByCodes(code, MetricCodes.YEAR_SUMMARY_CODES);

        int firstYear = currentYear;
        int lastYear = currentYear;
        for (Map<String, Map<YearMonth, Double>> source : List.of(facts, plans)) {
            for (Map<YearMonth, Double> byMonth : source.values()) {
                for (YearMonth month : byMonth.keySet()) {
                    firstYear = Math.min(firstYear, month.getYear());
                    lastYear = Math.max(lastYear, month.getYear());
                }
            }
        }

        List<Integer> years = new ArrayList<>();
        List<YearMonth> months = new ArrayList<>();
        for (int year = firstYear; year <= lastYear; year++) {
            years.add(year);
            for (int m = 1; m <= 12; m++) months.add(YearMonth.of(year, m));
        }

        List<YearMetricRow> rows = new ArrayList<>();
        for (String metricCode : MetricCodes.YEAR_SUMMARY_CODES) {
            rows.add(YearMetricRow.builder()
                    .code(metricCode)
                    .label(financialFactService.metricLabel(metricCode))
                    .fact(new TreeMap<>(facts.getOrDefault(metricCode, Map.of())))
                    .plan(new TreeMap<>(plans.getOrDefault(metricCode, Map.of())))
                    .build());
        }

        log.info("📈 Year summary {}: {}..{}", code, firstYear, lastYear);
        return YearSummary.builder()
                .branch(financialFactService.branch(code))
                .years(years)
                .months(months)
                .planYear(currentYear)
                .metrics(rows)
                .build();
    }
}
