package com.branchload.reporting.analytics;

import com.branchload.reporting.dto.report.MetricDelta;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Period-over-period deltas
 */
@Component
public class ComparisonEngine {

    /**
     * delta = current - previous; pct = delta / previous * 100 unless previous is 0.
     */
    public MetricDelta delta(Double current, Double previous) {
        if (current == null || previous == null) {
            return MetricDelta.empty();
        }
        double delta = current - previous;
        Double pct = previous != 0.0 ? delta / previous * 100 : null;
        return new MetricDelta(delta, pct);
    }

    public Map<String, MetricDelta> deltas(Collection<String> codes, Map<String, Double> current, Map<String, Double> previous) {
        Map<String, MetricDelta> result = new LinkedHashMap<>();
        for (String code : codes) {
            result.put(code, delta(current.get(code), previous.get(code)));
        }
        return result;
    }
}
