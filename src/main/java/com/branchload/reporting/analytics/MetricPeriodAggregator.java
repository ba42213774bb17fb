package com.branchload.reporting.analytics;

import com.branchload.reporting.entity.enums.MetricKind;
import com.branchload.reporting.util.PeriodWindows;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rolls daily metric values up to periods: additive metrics are summed, rate metrics averaged.
 * A period without any value yields null, never zero.
 */
@Component
public class MetricPeriodAggregator {

    public Double sum(Collection<Double> values) {
        List<Double> present = present(values);
        if (present.isEmpty()) return null;
        double total = 0.0;
        for (Double value : present) total += value;
        return total;
    }

    public Double average(Collection<Double> values) {
        List<Double> present = present(values);
        if (present.isEmpty()) return null;
        double total = 0.0;
        for (Double value : present) total += value;
        return total / present.size();
    }

    public Double aggregate(String metricCode, Collection<Double> values) {
        return MetricKind.classify(metricCode) == MetricKind.RATE ? average(values) : sum(values);
    }

    /**
     * Daily values of the window in day order, null for days without a fact.
     */
    public List<Double> slice(Map<LocalDate, Double> daily, PeriodWindows.Window window) {
        List<Double> values = new ArrayList<>();
        for (LocalDate day : window.days()) {
            values.add(daily != null ? daily.get(day) : null);
        }
        return values;
    }

    public Double aggregate(String metricCode, Map<LocalDate, Double> daily, PeriodWindows.Window window) {
        return aggregate(metricCode, slice(daily, window));
    }

    public List<Double> aggregateWeeks(String metricCode, Map<LocalDate, Double> daily, List<PeriodWindows.Window> weeks) {
        List<Double> totals = new ArrayList<>(weeks.size());
        for (PeriodWindows.Window week : weeks) {
            totals.add(aggregate(metricCode, daily, week));
        }
        return totals;
    }

    /**
     * One aggregate per code over the window; codes without data map to null.
     */
    public Map<String, Double> periodValues(Map<String, Map<LocalDate, Double>> valuesByCode,
                                            Collection<String> metricCodes, PeriodWindows.Window window) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (String code : metricCodes) {
            result.put(code, aggregate(code, valuesByCode.get(code), window));
        }
        return result;
    }

    private static List<Double> present(Collection<Double> values) {
        if (values == null) return List.of();
        return values.stream().filter(Objects::nonNull).toList();
    }
}
