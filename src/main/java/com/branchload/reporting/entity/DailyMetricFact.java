package com.branchload.reporting.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * DailyMetricFact Entity - Maps to manual_sheet_daily table
 * Unique per (branch_code, metric_code, fact_date)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyMetricFact {

    private String branchCode;
    private String metricCode;
    private LocalDate date;
    private Double value;

    @Builder.Default
    private String source = "manual";
}
