package com.branchload.reporting.analytics;

import com.branchload.reporting.entity.MetricDefinition;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Optional;

/**
 * Metrics of the monthly report, in display order
 */
@UtilityClass
public class MetricCatalog {

    public final String GROUP_COWORKING_REVENUE = "coworking_revenue";
    public final String GROUP_LOAD = "load";
    public final String GROUP_COFFEE_FACT = "coffee_fact";
    public final String GROUP_COFFEE_CATEGORIES = "coffee_categories";

    public final List<MetricDefinition> MONTHLY_REPORT_METRICS = List.of(
            metric(MetricCodes.REVENUE_OPEN_SPACE, "Open space rent", "rub", GROUP_COWORKING_REVENUE, true, false),
            metric(MetricCodes.REVENUE_CABINETS, "Cabinet rent", "rub", GROUP_COWORKING_REVENUE, true, false),
            metric(MetricCodes.REVENUE_LAB, "Lab", "rub", GROUP_COWORKING_REVENUE, true, false),
            metric(MetricCodes.REVENUE_RETAIL, "Retail", "rub", GROUP_COWORKING_REVENUE, true, false),
            metric(MetricCodes.LOAD_PERCENT, "Load %", "pct", GROUP_LOAD, false, false),
            metric(MetricCodes.COFFEE_REVENUE_TOTAL, "Coffee shop revenue", "rub", GROUP_COFFEE_FACT, true, false),
            metric(MetricCodes.COFFEE_CHECKS, "Coffee shop checks", "qty", GROUP_COFFEE_FACT, false, false),
            metric(MetricCodes.AVG_CHECK, "Average check", "rub", GROUP_COFFEE_FACT, false, true),
            metric(MetricCodes.WRITTEN_OFF_FOOD_TOTAL, "Food written off", "rub", GROUP_COFFEE_FACT, false, false),
            metric(MetricCodes.SOLD_FOOD_TOTAL, "Food sold", "rub", GROUP_COFFEE_FACT, false, false),
            metric(MetricCodes.REVENUE_COFFEE_HOT, "Coffee / hot drinks", "rub", GROUP_COFFEE_CATEGORIES, false, false),
            metric(MetricCodes.REVENUE_DRINKS_COLD, "Cold drinks", "rub", GROUP_COFFEE_CATEGORIES, false, false),
            metric(MetricCodes.REVENUE_DESSERTS, "Desserts", "rub", GROUP_COFFEE_CATEGORIES, false, false));

    public Optional<MetricDefinition> find(String code) {
        return MONTHLY_REPORT_METRICS.stream().filter(m -> m.getCode().equals(code)).findFirst();
    }

    private MetricDefinition metric(String code, String label, String unit, String group,
                                    boolean planEnabled, boolean derived) {
        return MetricDefinition.builder()
                .code(code)
                .label(label)
                .unit(unit)
                .groupName(group)
                .planEnabled(planEnabled)
                .derived(derived)
                .build();
    }
}
