package com.branchload.reporting.analytics;

import com.branchload.reporting.config.ReportingConfig;
import com.branchload.reporting.dto.report.CashDiscrepancy;
import com.branchload.reporting.dto.report.DriverItem;
import com.branchload.reporting.dto.report.LoadRevenueCheck;
import com.branchload.reporting.dto.report.MetricDelta;
import com.branchload.reporting.entity.enums.CheckStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Threshold signals over already aggregated values:
 * cash reconciliation, load vs. revenue mismatch, write-off rate, top revenue drivers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnomalyDetector {

    private final ReportingConfig reportingConfig;

    /**
     * For every day after the first: expected = previous closing balance + cash revenue + deposits - withdrawals.
     * Missing movements count as 0; a day missing its own or the previous balance is skipped.
     */
    public List<CashDiscrepancy> reconcileCash(List<LocalDate> days,
                                               Map<LocalDate, Double> closingBalance,
                                               Map<LocalDate, Double> cashRevenue,
                                               Map<LocalDate, Double> deposits,
                                               Map<LocalDate, Double> withdrawals) {
        List<CashDiscrepancy> discrepancies = new ArrayList<>();
        double threshold = reportingConfig.getCashThreshold();

        for (int i = 1; i < days.size(); i++) {
            LocalDate day = days.get(i);
            Double actual = valueOf(closingBalance, day);
            Double previous = valueOf(closingBalance, days.get(i - 1));
            if (actual == null || previous == null) {
                continue;
            }
            double expected = previous
                    + orZero(cashRevenue, day)
                    + orZero(deposits, day)
                    - orZero(withdrawals, day);
            double diff = actual - expected;
            if (Math.abs(diff) >= threshold) {
                discrepancies.add(CashDiscrepancy.builder()
                        .date(day)
                        .expected(expected)
                        .actual(actual)
                        .diff(diff)
                        .build());
            }
        }

        if (!discrepancies.isEmpty()) {
            log.debug("Cash reconciliation: {} day(s) off by at least {}", discrepancies.size(), threshold);
        }
        return discrepancies;
    }

    /**
     * High utilization but weak revenue: load at or above its trailing average while the
     * revenue stream is at or below the configured share of its own trailing average.
     */
    public LoadRevenueCheck loadRevenueCheck(String key, Double load, Double loadAvg, Double value, Double avg) {
        CheckStatus status;
        if (load == null || loadAvg == null || value == null || avg == null) {
            status = CheckStatus.NO_DATA;
        } else if (load >= loadAvg && value <= avg * reportingConfig.getRevenueDropRatio()) {
            status = CheckStatus.ALERT;
        } else {
            status = CheckStatus.OK;
        }
        return LoadRevenueCheck.builder()
                .key(key)
                .status(status)
                .load(load)
                .loadAvg(loadAvg)
                .value(value)
                .avg(avg)
                .build();
    }

    public boolean isWriteoffAlert(Double writeoffRate) {
        return writeoffRate != null && writeoffRate > reportingConfig.getWriteoffAlertRate();
    }

    /**
     * Codes with a positive delta and a known percentage, largest delta first, cut to the configured count.
     */
    public List<DriverItem> topDrivers(List<String> codes, Map<String, MetricDelta> deltas, Function<String, String> labels) {
        List<DriverItem> drivers = new ArrayList<>();
        for (String code : codes) {
            MetricDelta delta = deltas.get(code);
            if (delta == null || delta.getDelta() == null || delta.getPct() == null || delta.getDelta() <= 0) {
                continue;
            }
            drivers.add(DriverItem.builder()
                    .code(code)
                    .label(labels.apply(code))
                    .delta(delta.getDelta())
                    .pct(delta.getPct())
                    .build());
        }
        drivers.sort(Comparator.comparingDouble(DriverItem::getDelta).reversed());
        return drivers.size() > reportingConfig.getTopDrivers()
                ? new ArrayList<>(drivers.subList(0, reportingConfig.getTopDrivers()))
                : drivers;
    }

    private static Double valueOf(Map<LocalDate, Double> series, LocalDate day) {
        return series != null ? series.get(day) : null;
    }

    private static double orZero(Map<LocalDate, Double> series, LocalDate day) {
        Double value = valueOf(series, day);
        return value != null ? value : 0.0;
    }
}
