package com.branchload.reporting.service;

import com.branchload.reporting.analytics.AnomalyDetector;
import com.branchload.reporting.analytics.ComparisonEngine;
import com.branchload.reporting.analytics.DerivedMetricCalculator;
import com.branchload.reporting.analytics.MetricCodes;
import com.branchload.reporting.analytics.MetricPeriodAggregator;
import com.branchload.reporting.config.ReportingConfig;
import com.branchload.reporting.dto.report.CashDiscrepancy;
import com.branchload.reporting.dto.report.CheckResult;
import com.branchload.reporting.dto.report.LoadRevenueCheck;
import com.branchload.reporting.dto.report.MetricDelta;
import com.branchload.reporting.dto.report.OverviewAlert;
import com.branchload.reporting.dto.report.OverviewReport;
import com.branchload.reporting.entity.enums.CheckStatus;
import com.branchload.reporting.repository.DailyMetricRepository;
import com.branchload.reporting.util.PeriodWindows;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Overview Service - month-to-date dashboard for one branch
 *
 * OPTIMIZED: a single range read covers the current month, the same month a year earlier
 * and the trailing weeks; all periods are cut from that map in memory.
 *
 * Month to date ends at the last day carrying any non-load value. The year-ago period
 * covers the same day numbers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OverviewService {

    public static final String CHECK_CASH = "cash";
    public static final String CHECK_LOAD_OPEN = "load_open";
    public static final String CHECK_LOAD_COFFEE = "load_coffee";
    public static final String ALERT_WRITEOFF = "writeoff";

    private static final Map<String, String> DRIVER_LABELS = Map.of(
            MetricCodes.REVENUE_OPEN_SPACE, "Open space",
            MetricCodes.REVENUE_CABINETS, "Cabinets",
            MetricCodes.REVENUE_LECTURE, "Lecture hall",
            MetricCodes.REVENUE_LAB, "Lab",
            MetricCodes.REVENUE_RETAIL, "Retail",
            MetricCodes.REVENUE_SALON, "Salon services",
            MetricCodes.REVENUE_DRINKS_TOTAL, "Drinks",
            MetricCodes.SOLD_FOOD_TOTAL, "Food",
            MetricCodes.REVENUE_DESSERTS, "Desserts");

    private final ReportingConfig reportingConfig;
    private final FinancialFactService financialFactService;
    private final DailyMetricRepository dailyMetricRepository;
    private final DailyLoadProvider dailyLoadProvider;
    private final MetricPeriodAggregator periodAggregator;
    private final DerivedMetricCalculator derivedCalculator;
    private final ComparisonEngine comparisonEngine;
    private final AnomalyDetector anomalyDetector;

    public OverviewReport build(String branchCode, String month) {
        String code = FinancialFactService.normalizeBranchCode(branchCode);
        YearMonth current = PeriodWindows.parseMonth(month);
        LocalDate monthStart = current.atDay(1);
        LocalDate monthEnd = current.atEndOfMonth();
        LocalDate yoyStart = current.minusYears(1).atDay(1);

        int trailingWeeks = reportingConfig.getTrailingWeeks();
        LocalDate weeksStart = monthStart.minusDays(7L * trailingWeeks);
        LocalDate analysisStart = weeksStart.isBefore(yoyStart) ? weeksStart : yoyStart;

        Map<String, Map<LocalDate, Double>> values =
                dailyMetricRepository.findValues(code, MetricCodes.BASE_CODES, analysisStart, monthEnd);
        Map<LocalDate, Double> load = dailyLoadProvider.dailyLoad(code, analysisStart, monthEnd);
        if (!load.isEmpty()) {
            values.put(MetricCodes.LOAD_PERCENT, new TreeMap<>(load));
        }

        // Month to date
        List<LocalDate> monthDays = PeriodWindows.monthDays(current);
        List<LocalDate> filled = monthDays.stream().filter(day -> hasNonLoadValue(values, day)).toList();
        int cutoffDay = filled.isEmpty() ? 0 : filled.get(filled.size() - 1).getDayOfMonth();
        LocalDate cutoffDate = cutoffDay > 0 ? current.atDay(cutoffDay) : null;

        Map<String, Double> currentValues = new LinkedHashMap<>();
        Map<String, Double> yoyValues = new LinkedHashMap<>();
        if (cutoffDate != null) {
            currentValues = periodValues(values, new PeriodWindows.Window(monthStart, cutoffDate));
            yoyValues = periodValues(values, new PeriodWindows.Window(yoyStart, yoyStart.plusDays(cutoffDay - 1L)));
        }

        // Trailing weeks
        List<PeriodWindows.Window> weeks = PeriodWindows.lastWeeks(cutoffDate != null ? cutoffDate : monthEnd, trailingWeeks);
        Map<String, List<Double>> weeklyValues = new LinkedHashMap<>();
        MetricCodes.BASE_CODES.forEach(c -> weeklyValues.put(c, new ArrayList<>()));
        for (PeriodWindows.Window week : weeks) {
            Map<String, Double> period = periodAggregator.periodValues(values, MetricCodes.BASE_CODES, week);
            MetricCodes.BASE_CODES.forEach(c -> weeklyValues.get(c).add(period.get(c)));
        }
        Map<String, Double> averages = new LinkedHashMap<>();
        for (String avgCode : List.of(MetricCodes.LOAD_PERCENT, MetricCodes.REVENUE_OPEN_SPACE, MetricCodes.COFFEE_REVENUE_TOTAL)) {
            averages.put(avgCode, periodAggregator.average(weeklyValues.get(avgCode)));
        }

        // Cash control
        List<CashDiscrepancy> cashControl = cutoffDay > 0
                ? anomalyDetector.reconcileCash(monthDays.subList(0, cutoffDay),
                        values.get(MetricCodes.CASH_BALANCE_END_DAY),
                        values.get(MetricCodes.REVENUE_CASH),
                        values.get(MetricCodes.DEPOSIT_TOTAL),
                        values.get(MetricCodes.WITHDRAWALS_TOTAL))
                : List.of();

        // Comparisons
        Map<String, MetricDelta> driverDeltas = comparisonEngine.deltas(MetricCodes.DRIVER_CODES, currentValues, yoyValues);
        Map<String, MetricDelta> yoyDelta = comparisonEngine.deltas(MetricCodes.YOY_DELTA_CODES, currentValues, yoyValues);

        Map<String, Double> coefficients = new LinkedHashMap<>();
        coefficients.put(MetricCodes.AVG_CHECK, currentValues.get(MetricCodes.AVG_CHECK));
        coefficients.put(MetricCodes.WRITEOFF_RATE, currentValues.get(MetricCodes.WRITEOFF_RATE_FULL));
        coefficients.put(MetricCodes.LAB_TO_OPEN_SPACE_RATIO, currentValues.get(MetricCodes.LAB_TO_OPEN_SPACE_RATIO));

        // Signals
        Double currentLoad = currentValues.get(MetricCodes.LOAD_PERCENT);
        Double loadAvg = averages.get(MetricCodes.LOAD_PERCENT);
        LoadRevenueCheck loadOpen = anomalyDetector.loadRevenueCheck(CHECK_LOAD_OPEN, currentLoad, loadAvg,
                currentValues.get(MetricCodes.REVENUE_OPEN_SPACE), averages.get(MetricCodes.REVENUE_OPEN_SPACE));
        LoadRevenueCheck loadCoffee = anomalyDetector.loadRevenueCheck(CHECK_LOAD_COFFEE, currentLoad, loadAvg,
                currentValues.get(MetricCodes.COFFEE_REVENUE_TOTAL), averages.get(MetricCodes.COFFEE_REVENUE_TOTAL));
        Double maxDiff = cashControl.stream().map(d -> Math.abs(d.getDiff())).max(Double::compare).orElse(null);
        Double writeoffRate = currentValues.get(MetricCodes.WRITEOFF_RATE_FULL);

        List<OverviewAlert> alerts = new ArrayList<>();
        if (!cashControl.isEmpty()) {
            alerts.add(OverviewAlert.builder().type(CHECK_CASH).count(cashControl.size()).maxDiff(maxDiff).build());
        }
        if (anomalyDetector.isWriteoffAlert(writeoffRate)) {
            alerts.add(OverviewAlert.builder().type(ALERT_WRITEOFF).rate(writeoffRate).build());
        }
        for (LoadRevenueCheck check : List.of(loadOpen, loadCoffee)) {
            if (check.isAlert()) {
                alerts.add(OverviewAlert.builder().type(check.getKey()).load(check.getLoad())
                        .loadAvg(check.getLoadAvg()).value(check.getValue()).avg(check.getAvg()).build());
            }
        }
        if (alerts.size() > reportingConfig.getMaxAlerts()) {
            alerts = new ArrayList<>(alerts.subList(0, reportingConfig.getMaxAlerts()));
        }

        List<CheckResult> checks = new ArrayList<>();
        checks.add(CheckResult.builder()
                .key(CHECK_CASH)
                .status(!cashControl.isEmpty() ? CheckStatus.ALERT : cutoffDay > 0 ? CheckStatus.OK : CheckStatus.NO_DATA)
                .count(cashControl.size())
                .maxDiff(maxDiff)
                .build());
        checks.add(toCheck(loadOpen));
        checks.add(toCheck(loadCoffee));

        log.info("📊 Overview {} {}: days 1-{} of {}, {} alert(s)", code, current, cutoffDay, monthDays.size(), alerts.size());
        return OverviewReport.builder()
                .branch(financialFactService.branch(code))
                .month(current.toString())
                .cutoffDay(cutoffDay)
                .daysInMonth(monthDays.size())
                .filledDays(filled.size())
                .rangeLabel(cutoffDay > 0 ? "1–" + cutoffDay : "")
                .current(currentValues)
                .yoy(yoyValues)
                .yoyDelta(yoyDelta)
                .coefficients(coefficients)
                .drivers(anomalyDetector.topDrivers(MetricCodes.DRIVER_CODES, driverDeltas, OverviewService::driverLabel))
                .alerts(alerts)
                .checks(checks)
                .cashControl(cashControl)
                .weeks(weeks)
                .weeklyValues(weeklyValues)
                .averages(averages)
                .build();
    }

    static String driverLabel(String metricCode) {
        return DRIVER_LABELS.getOrDefault(metricCode, metricCode);
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private Map<String, Double> periodValues(Map<String, Map<LocalDate, Double>> values, PeriodWindows.Window window) {
        Map<String, Double> period = periodAggregator.periodValues(values, MetricCodes.BASE_CODES, window);
        period.putAll(derivedCalculator.compute(period));
        return period;
    }

    private static boolean hasNonLoadValue(Map<String, Map<LocalDate, Double>> values, LocalDate day) {
        for (String code : MetricCodes.BASE_CODES) {
            if (MetricCodes.LOAD_PERCENT.equals(code)) continue;
            Map<LocalDate, Double> series = values.get(code);
            if (series != null && Objects.nonNull(series.get(day))) return true;
        }
        return false;
    }

    private static CheckResult toCheck(LoadRevenueCheck check) {
        return CheckResult.builder()
                .key(check.getKey())
                .status(check.getStatus())
                .load(check.getLoad())
                .loadAvg(check.getLoadAvg())
                .value(check.getValue())
                .avg(check.getAvg())
                .build();
    }
}
