package com.branchload.reporting.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyMetricRow {

    private String code;
    private String label;
    private String unit;
    private String groupName;
    private boolean planEnabled;

    /** One entry per day of the month, null where no fact exists */
    @Builder.Default
    private List<Double> values = new ArrayList<>();

    /** Previous-month weeks, previous-month total, current-month weeks */
    @Builder.Default
    private List<Double> weekTotals = new ArrayList<>();

    private Double prevMonthTotal;
    private Double monthTotal;
    private Double plan;
    private Double planPct;
    private Double planDelta;
    private Double forecast;
    private Double forecastPct;
}
