package com.branchload.reporting.dto.report;

import com.branchload.reporting.entity.Branch;
import com.branchload.reporting.util.PeriodWindows;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Month-to-date overview: YoY comparison, trailing weeks, drivers, alerts and checks
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverviewReport {

    private Branch branch;
    private String month;

    // Month to date
    private int cutoffDay;
    private int daysInMonth;
    private int filledDays;
    private String rangeLabel;

    @Builder.Default
    private Map<String, Double> current = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> yoy = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, MetricDelta> yoyDelta = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> coefficients = new LinkedHashMap<>();

    @Builder.Default
    private List<DriverItem> drivers = new ArrayList<>();

    @Builder.Default
    private List<OverviewAlert> alerts = new ArrayList<>();

    @Builder.Default
    private List<CheckResult> checks = new ArrayList<>();

    @Builder.Default
    private List<CashDiscrepancy> cashControl = new ArrayList<>();

    // Trailing weeks
    @Builder.Default
    private List<PeriodWindows.Window> weeks = new ArrayList<>();

    @Builder.Default
    private Map<String, List<Double>> weeklyValues = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> averages = new LinkedHashMap<>();

    public CheckResult check(String key) {
        return checks.stream().filter(c -> key.equals(c.getKey())).findFirst().orElse(null);
    }
}
