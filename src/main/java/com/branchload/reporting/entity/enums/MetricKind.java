package com.branchload.reporting.entity.enums;

import java.util.List;
import java.util.Locale;

/**
 * How a metric rolls up across a period: additive metrics are summed, rate metrics averaged.
 */
public enum MetricKind {
    ADDITIVE,
    RATE;

    private static final List<String> RATE_HINTS = List.of("percent", "ratio", "share");

    public static MetricKind classify(String metricCode) {
        if (metricCode == null) {
            return ADDITIVE;
        }
        String lowered = metricCode.toLowerCase(Locale.ROOT);
        if (lowered.endsWith("_pct") || lowered.endsWith("_percent")) {
            return RATE;
        }
        return RATE_HINTS.stream().anyMatch(lowered::contains) ? RATE : ADDITIVE;
    }
}
