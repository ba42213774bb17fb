package com.branchload.reporting.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.YearMonth;
import java.util.Map;
import java.util.TreeMap;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class YearMetricRow {

    private String code;
    private String label;

    @Builder.Default
    private Map<YearMonth, Double> fact = new TreeMap<>();

    @Builder.Default
    private Map<YearMonth, Double> plan = new TreeMap<>();
}
