package com.branchload.reporting.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Dense benchmark-hours x 7 days occupancy grid of one group
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeatmapGrid {

    private long branchId;
    private String groupId;
    private String groupName;
    private LocalDate weekStart;

    @Builder.Default
    private List<Integer> hours = new ArrayList<>();

    @Builder.Default
    private List<HeatmapDay> days = new ArrayList<>();

    public HeatmapCell cell(LocalDate date, int hour) {
        return days.stream()
                .filter(d -> d.getDate().equals(date))
                .flatMap(d -> d.getCells().stream())
                .filter(c -> c.getHour() == hour)
                .findFirst()
                .orElse(null);
    }
}
