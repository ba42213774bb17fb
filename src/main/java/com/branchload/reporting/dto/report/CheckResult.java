package com.branchload.reporting.dto.report;

import com.branchload.reporting.entity.enums.CheckStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckResult {

    private String key;
    private CheckStatus status;
    private Integer count;
    private Double maxDiff;
    private Double load;
    private Double loadAvg;
    private Double value;
    private Double avg;
}
