package com.branchload.reporting.service;

import com.branchload.reporting.analytics.DerivedMetricCalculator;
import com.branchload.reporting.analytics.MetricCodes;
import com.branchload.reporting.analytics.MetricPeriodAggregator;
import com.branchload.reporting.dto.report.MonthlyMetricReport;
import com.branchload.reporting.dto.report.MonthlyMetricRow;
import com.branchload.reporting.entity.Branch;
import com.branchload.reporting.entity.MetricDefinition;
import com.branchload.reporting.entity.enums.MetricKind;
import com.branchload.reporting.repository.DailyMetricRepository;
import com.branchload.reporting.repository.MonthlyPlanRepository;
import com.branchload.reporting.util.PeriodWindows;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Monthly Report Service - per-metric month sheet with weekly roll-ups, plan and run-rate forecast
 *
 * PATTERN: one range read for the previous and current month, everything else computed in memory.
 * Weeks are Monday-start chunks clipped to their month; the previous month's weeks come first,
 * followed by the previous-month total and the current month's weeks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonthlyReportService {

    static final String PREV_MONTH_TOTAL_LABEL = "Prev month total";
    private static final DateTimeFormatter LABEL_DATE = DateTimeFormatter.ofPattern("dd.MM");

    private final FinancialFactService financialFactService;
    private final DailyMetricRepository dailyMetricRepository;
    private final MonthlyPlanRepository monthlyPlanRepository;
    private final DailyLoadProvider dailyLoadProvider;
    private final MetricPeriodAggregator periodAggregator;
    private final DerivedMetricCalculator derivedCalculator;

    public MonthlyMetricReport build(String branchCode, String month) {
        String code = FinancialFactService.normalizeBranchCode(branchCode);
        YearMonth current = PeriodWindows.parseMonth(month);
        YearMonth previous = current.minusMonths(1);
        Branch branch = financialFactService.branch(code);

        List<LocalDate> prevDays = PeriodWindows.monthDays(previous);
        List<LocalDate> currDays = PeriodWindows.monthDays(current);
        List<PeriodWindows.Window> prevWeeks = PeriodWindows.weekChunks(prevDays);
        List<PeriodWindows.Window> currWeeks = PeriodWindows.weekChunks(currDays);
        PeriodWindows.Window prevMonth = PeriodWindows.monthWindow(previous);
        PeriodWindows.Window currMonth = PeriodWindows.monthWindow(current);

        List<MetricDefinition> metrics = financialFactService.metricCatalog();
        Map<String, Map<LocalDate, Double>> values = dailyMetricRepository.findValues(
                code, readCodes(metrics), prevMonth.start(), currMonth.end());
        overlayLoad(code, values, prevMonth.start(), currMonth.end());
        Map<String, Double> plans = monthlyPlanRepository.findByMonth(code, current);

        List<MonthlyMetricRow> rows = new ArrayList<>();
        for (MetricDefinition metric : metrics) {
            Map<LocalDate, Double> daily = Boolean.TRUE.equals(metric.getDerived())
                    ? derivedDaily(metric.getCode(), values)
                    : values.getOrDefault(metric.getCode(), Map.of());

            List<Double> weekTotals = new ArrayList<>();
            for (PeriodWindows.Window week : prevWeeks) weekTotals.add(periodValue(metric, daily, values, week));
            Double prevMonthTotal = periodValue(metric, daily, values, prevMonth);
            weekTotals.add(prevMonthTotal);
            for (PeriodWindows.Window week : currWeeks) weekTotals.add(periodValue(metric, daily, values, week));

            List<Double> currValues = periodAggregator.slice(daily, currMonth);
            Double monthTotal = periodValue(metric, daily, values, currMonth);
            long filled = currValues.stream().filter(v -> v != null).count();
            Double forecast = forecast(metric, monthTotal, filled, currDays.size());

            Double plan = Boolean.TRUE.equals(metric.getPlanEnabled()) ? plans.get(metric.getCode()) : null;
            rows.add(MonthlyMetricRow.builder()
                    .code(metric.getCode())
                    .label(metric.getLabel())
                    .unit(metric.getUnit())
                    .groupName(metric.getGroupName())
                    .planEnabled(Boolean.TRUE.equals(metric.getPlanEnabled()))
                    .values(currValues)
                    .weekTotals(weekTotals)
                    .prevMonthTotal(prevMonthTotal)
                    .monthTotal(monthTotal)
                    .plan(plan)
                    .planPct(percentOf(monthTotal, plan))
                    .planDelta(plan != null && monthTotal != null ? monthTotal - plan : null)
                    .forecast(forecast)
                    .forecastPct(percentOf(forecast, plan))
                    .build());
        }

        List<PeriodWindows.Window> weeks = new ArrayList<>(prevWeeks);
        weeks.addAll(currWeeks);
        log.info("📅 Monthly report {} {}: {} metric(s), {} week(s)", code, current, rows.size(), weeks.size());
        return MonthlyMetricReport.builder()
                .branch(branch)
                .month(current.toString())
                .days(currDays)
                .weeks(weeks)
                .weekLabels(weekLabels(prevWeeks, currWeeks))
                .metrics(rows)
                .build();
    }

    static List<String> weekLabels(List<PeriodWindows.Window> prevWeeks, List<PeriodWindows.Window> currWeeks) {
        List<String> labels = new ArrayList<>();
        for (int i = 0; i < prevWeeks.size(); i++) {
            labels.add("W-" + (prevWeeks.size() - i) + " " + range(prevWeeks.get(i)));
        }
        labels.add(PREV_MONTH_TOTAL_LABEL);
        for (int i = 0; i < currWeeks.size(); i++) {
            labels.add("W" + (i + 1) + " " + range(currWeeks.get(i)));
        }
        return labels;
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private Set<String> readCodes(List<MetricDefinition> metrics) {
        Set<String> codes = new LinkedHashSet<>();
        metrics.forEach(m -> codes.add(m.getCode()));
        codes.add(MetricCodes.COFFEE_REVENUE_TOTAL);
        codes.add(MetricCodes.COFFEE_CHECKS);
        return codes;
    }

    private void overlayLoad(String code, Map<String, Map<LocalDate, Double>> values, LocalDate from, LocalDate to) {
        Map<LocalDate, Double> load = dailyLoadProvider.dailyLoad(code, from, to);
        if (!load.isEmpty()) {
            values.put(MetricCodes.LOAD_PERCENT, new TreeMap<>(load));
        }
    }

    private Map<LocalDate, Double> derivedDaily(String metricCode, Map<String, Map<LocalDate, Double>> values) {
        Map<LocalDate, Double> daily = new TreeMap<>();
        if (!MetricCodes.AVG_CHECK.equals(metricCode)) {
            return daily;
        }
        Map<LocalDate, Double> revenue = values.getOrDefault(MetricCodes.COFFEE_REVENUE_TOTAL, Map.of());
        Map<LocalDate, Double> checks = values.getOrDefault(MetricCodes.COFFEE_CHECKS, Map.of());
        for (Map.Entry<LocalDate, Double> entry : revenue.entrySet()) {
            Double value = derivedCalculator.averageCheck(entry.getValue(), checks.get(entry.getKey()));
            if (value != null) daily.put(entry.getKey(), value);
        }
        return daily;
    }

    /**
     * Derived ratios are recomputed from period totals rather than averaged day by day.
     */
    private Double periodValue(MetricDefinition metric, Map<LocalDate, Double> daily,
                               Map<String, Map<LocalDate, Double>> values, PeriodWindows.Window window) {
        if (Boolean.TRUE.equals(metric.getDerived()) && MetricCodes.AVG_CHECK.equals(metric.getCode())) {
            return derivedCalculator.averageCheck(
                    periodAggregator.aggregate(MetricCodes.COFFEE_REVENUE_TOTAL, values.get(MetricCodes.COFFEE_REVENUE_TOTAL), window),
                    periodAggregator.aggregate(MetricCodes.COFFEE_CHECKS, values.get(MetricCodes.COFFEE_CHECKS), window));
        }
        return periodAggregator.aggregate(metric.getCode(), daily, window);
    }

    private static Double forecast(MetricDefinition metric, Double monthTotal, long filled, int daysInMonth) {
        if (filled == 0 || monthTotal == null) return null;
        if (metric.getKind() == MetricKind.RATE || Boolean.TRUE.equals(metric.getDerived())) {
            return monthTotal;
        }
        return monthTotal / filled * daysInMonth;
    }

    private static Double percentOf(Double value, Double base) {
        if (value == null || base == null || base == 0.0) return null;
        return value / base * 100.0;
    }

    private static String range(PeriodWindows.Window window) {
        return "(" + window.start().format(LABEL_DATE) + "-" + window.end().format(LABEL_DATE) + ")";
    }
}
