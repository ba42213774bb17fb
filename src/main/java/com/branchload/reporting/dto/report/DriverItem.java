package com.branchload.reporting.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Revenue line ranked by positive year-over-year growth
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverItem {

    private String code;
    private String label;
    private double delta;
    private double pct;
}
