package com.branchload.reporting.analytics;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ratios and totals derived from period values. Unknown inputs give null, never zero,
 * and a zero denominator gives null instead of infinity or NaN.
 */
@Component
public class DerivedMetricCalculator {

    public Double safeDiv(Double numerator, Double denominator) {
        if (numerator == null || denominator == null || denominator == 0.0) {
            return null;
        }
        return numerator / denominator;
    }

    /**
     * Sum of the present values; null when none is present.
     */
    public Double safeSum(Collection<Double> values) {
        List<Double> present = values.stream().filter(Objects::nonNull).toList();
        if (present.isEmpty()) {
            return null;
        }
        double total = 0.0;
        for (Double value : present) total += value;
        return total;
    }

    public Double safeSum(Double... values) {
        return safeSum(Arrays.asList(values));
    }

    public Double averageCheck(Double coffeeRevenue, Double coffeeChecks) {
        return safeDiv(coffeeRevenue, coffeeChecks);
    }

    public Double writeoffRateFull(Double writtenOff, Double sold) {
        return safeDiv(writtenOff, safeSum(sold, writtenOff));
    }

    public Map<String, Double> compute(Map<String, Double> values) {
        Double revenueTotal = values.get(MetricCodes.REVENUE_TOTAL);
        Double coffeeRevenue = values.get(MetricCodes.COFFEE_REVENUE_TOTAL);
        Double soldFood = values.get(MetricCodes.SOLD_FOOD_TOTAL);
        Double writtenOff = values.get(MetricCodes.WRITTEN_OFF_FOOD_TOTAL);
        Double load = values.get(MetricCodes.LOAD_PERCENT);
        Double openSpace = values.get(MetricCodes.REVENUE_OPEN_SPACE);
        Double foodPurchase = values.get(MetricCodes.EXPENSE_FOOD_PURCHASE);

        Map<String, Double> derived = new LinkedHashMap<>();
        derived.put(MetricCodes.AVG_CHECK, averageCheck(coffeeRevenue, values.get(MetricCodes.COFFEE_CHECKS)));
        derived.put(MetricCodes.WRITEOFF_RATE, safeDiv(writtenOff, soldFood));
        derived.put(MetricCodes.WRITEOFF_RATE_FULL, writeoffRateFull(writtenOff, soldFood));
        derived.put(MetricCodes.LAB_TO_OPEN_SPACE_RATIO, safeDiv(values.get(MetricCodes.REVENUE_LAB), openSpace));
        derived.put(MetricCodes.REVENUE_PER_LOAD, safeDiv(openSpace, load));
        derived.put(MetricCodes.COFFEE_REVENUE_PER_LOAD, safeDiv(coffeeRevenue, load));

        Double totalExpenses = safeSum(MetricCodes.EXPENSE_CODES.stream().map(values::get).toList());
        derived.put(MetricCodes.TOTAL_EXPENSES, totalExpenses);
        derived.put(MetricCodes.EXPENSE_RATIO, safeDiv(totalExpenses, revenueTotal));

        derived.put(MetricCodes.GROSS_PROFIT,
                revenueTotal != null && foodPurchase != null ? revenueTotal - foodPurchase : null);

        Double operatingProfit = revenueTotal != null && totalExpenses != null ? revenueTotal - totalExpenses : null;
        derived.put(MetricCodes.OPERATING_PROFIT, operatingProfit);
        derived.put(MetricCodes.OPERATING_MARGIN, safeDiv(operatingProfit, revenueTotal));

        derived.put(MetricCodes.COWORKING_TOTAL,
                safeSum(MetricCodes.COWORKING_CODES.stream().map(values::get).toList()));
        return derived;
    }
}
