package com.branchload.reporting.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Change between two period values; both fields null when either side is unknown
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricDelta {

    private Double delta;
    private Double pct;

    public static MetricDelta empty() {
        return new MetricDelta(null, null);
    }
}
