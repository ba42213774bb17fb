package com.branchload.reporting.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeatmapCell {

    private LocalDate date;
    private int hour;
    private double loadPct;
    private int busyCount;
    private int staffTotal;
}
