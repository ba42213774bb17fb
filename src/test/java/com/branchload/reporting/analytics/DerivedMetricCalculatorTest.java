package com.branchload.reporting.analytics;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * DerivedMetricCalculator Test - ratio safety and derived totals
 */
class DerivedMetricCalculatorTest {

    private final DerivedMetricCalculator calculator = new DerivedMetricCalculator();

    @Test
    void shouldGuardAverageCheck() {
        assertThat(calculator.averageCheck(null, 5.0)).isNull();
        assertThat(calculator.averageCheck(500.0, 0.0)).isNull();
        assertThat(calculator.averageCheck(500.0, 5.0)).isEqualTo(100.0);
    }

    @Test
    void shouldComputeWriteoffRates() {
        assertThat(calculator.writeoffRateFull(20.0, 180.0)).isEqualTo(0.1);
        assertThat(calculator.writeoffRateFull(20.0, null)).isEqualTo(1.0);
        assertThat(calculator.writeoffRateFull(null, 100.0)).isNull();
        assertThat(calculator.writeoffRateFull(0.0, 0.0)).isNull();
    }

    @Test
    void shouldComputeDerivedMetricsFromPeriodValues() {
        Map<String, Double> values = new HashMap<>();
        values.put(MetricCodes.REVENUE_TOTAL, 1000.0);
        values.put(MetricCodes.REVENUE_OPEN_SPACE, 400.0);
        values.put(MetricCodes.REVENUE_LAB, 100.0);
        values.put(MetricCodes.LOAD_PERCENT, 50.0);
        values.put(MetricCodes.EXPENSE_FOOD_PURCHASE, 300.0);

        Map<String, Double> derived = calculator.compute(values);

        assertThat(derived.get(MetricCodes.LAB_TO_OPEN_SPACE_RATIO)).isEqualTo(0.25);
        assertThat(derived.get(MetricCodes.REVENUE_PER_LOAD)).isEqualTo(8.0);
        assertThat(derived.get(MetricCodes.GROSS_PROFIT)).isEqualTo(700.0);
        assertThat(derived.get(MetricCodes.TOTAL_EXPENSES)).isEqualTo(300.0);
        assertThat(derived.get(MetricCodes.OPERATING_PROFIT)).isEqualTo(700.0);
        assertThat(derived.get(MetricCodes.OPERATING_MARGIN)).isEqualTo(0.7);
        assertThat(derived.get(MetricCodes.COWORKING_TOTAL)).isEqualTo(500.0);
        assertThat(derived.get(MetricCodes.AVG_CHECK)).isNull();
    }

    @Test
    void shouldLeaveTotalsNullWithoutInputs() {
        Map<String, Double> derived = calculator.compute(Map.of());

        assertThat(derived).containsKeys(MetricCodes.TOTAL_EXPENSES, MetricCodes.COWORKING_TOTAL);
        assertThat(derived.values()).containsOnlyNulls();
    }
}
