package com.branchload.reporting.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * StaffHourFact Entity - Maps to staff_hour_busy table
 * Primary key: (branch_id, staff_id, work_date, hour_of_day)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StaffHourFact {

    private Long branchId;
    private Long staffId;
    private LocalDate date;
    private Integer hour;

    @Builder.Default private Boolean busy = true;
    @Builder.Default private Boolean inBenchmark = false;
    @Builder.Default private Boolean inGray = false;
}
