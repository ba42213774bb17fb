package com.branchload.reporting.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * GroupHourLoad Entity - Maps to group_hour_load table
 * Primary key: (branch_id, group_id, work_date, hour_of_day)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupHourLoad {

    private Long branchId;
    private String groupId;
    private LocalDate date;

    /** ISO day of week, Monday = 1 */
    private Integer dow;
    private Integer hour;

    @Builder.Default private Integer busyCount = 0;
    @Builder.Default private Integer staffTotal = 0;
    @Builder.Default private Double loadPct = 0.0;
    @Builder.Default private Boolean inBenchmark = false;
}
