package com.branchload.reporting.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * MonthlyPlan Entity - Maps to plans_monthly table
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyPlan {

    private String branchCode;
    private String metricCode;
    private LocalDate monthStart;
    private Double value;
}
