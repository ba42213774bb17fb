package com.branchload.reporting.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Benchmark-hour load averages of one group over a month
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthLoadSummary {

    private long branchId;
    private String groupId;
    private YearMonth month;

    /** Every day of the month, 0.0 when the day has no benchmark rows */
    @Builder.Default
    private Map<LocalDate, Double> dailyAverages = new LinkedHashMap<>();

    @Builder.Default
    private List<WeekLoad> weeklyAverages = new ArrayList<>();

    private double monthAverage;
}
