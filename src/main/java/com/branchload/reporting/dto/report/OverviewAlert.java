package com.branchload.reporting.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverviewAlert {

    private String type;
    private Integer count;
    private Double maxDiff;
    private Double rate;
    private Double load;
    private Double loadAvg;
    private Double value;
    private Double avg;
}
