package com.branchload.reporting.entity;

import com.branchload.reporting.entity.enums.MetricKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * MetricDefinition Entity - Maps to metrics table
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricDefinition {

    private String code;
    private String label;
    private String unit;
    private String groupName;

    @Builder.Default private Boolean derived = false;
    @Builder.Default private Boolean planEnabled = false;

    public MetricKind getKind() {
        return MetricKind.classify(code);
    }
}
