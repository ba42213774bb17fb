package com.branchload.reporting.dto.report;

import com.branchload.reporting.entity.Branch;
import com.branchload.reporting.util.PeriodWindows;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Month report: daily values, weekly totals, plan and forecast per metric
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyMetricReport {

    private Branch branch;
    private String month;

    @Builder.Default
    private List<LocalDate> days = new ArrayList<>();

    /** Previous-month week windows followed by current-month ones */
    @Builder.Default
    private List<PeriodWindows.Window> weeks = new ArrayList<>();

    @Builder.Default
    private List<String> weekLabels = new ArrayList<>();

    @Builder.Default
    private List<MonthlyMetricRow> metrics = new ArrayList<>();

    public MonthlyMetricRow metric(String code) {
        return metrics.stream().filter(m -> m.getCode().equals(code)).findFirst().orElse(null);
    }
}
