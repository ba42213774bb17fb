package com.branchload.reporting.entity.enums;

/**
 * Lifecycle of a submitted rebuild job
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
