package com.branchload.reporting.dto.report;

import com.branchload.reporting.entity.Branch;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class YearSummary {

    private Branch branch;

    @Builder.Default
    private List<Integer> years = new ArrayList<>();

    @Builder.Default
    private List<YearMonth> months = new ArrayList<>();

    private int planYear;

    @Builder.Default
    private List<YearMetricRow> metrics = new ArrayList<>();
}
