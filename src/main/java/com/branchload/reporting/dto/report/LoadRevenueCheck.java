package com.branchload.reporting.dto.report;

import com.branchload.reporting.entity.enums.CheckStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * High utilization vs. weak revenue heuristic for one revenue stream
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadRevenueCheck {

    private String key;
    private CheckStatus status;
    private Double load;
    private Double loadAvg;
    private Double value;
    private Double avg;

    public boolean isAlert() {
        return status == CheckStatus.ALERT;
    }
}
