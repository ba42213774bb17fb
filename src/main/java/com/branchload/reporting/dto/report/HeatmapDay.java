package com.branchload.reporting.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeatmapDay {

    private LocalDate date;

    /** ISO day of week, Monday = 1 */
    private int dow;

    @Builder.Default
    private List<HeatmapCell> cells = new ArrayList<>();

    /** Busy before the benchmark window */
    private boolean early;

    /** Busy after the benchmark window */
    private boolean late;
}
