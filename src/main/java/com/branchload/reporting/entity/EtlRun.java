package com.branchload.reporting.entity;

import com.branchload.reporting.entity.enums.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * EtlRun Entity - Maps to etl_runs table
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EtlRun {

    private String runId;
    private String runType;
    private Instant startedAt;
    private Instant finishedAt;

    @Builder.Default
    private RunStatus status = RunStatus.RUNNING;

    @Builder.Default
    private String progress = "0%";

    @Builder.Default
    private String errorLog = "";

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
