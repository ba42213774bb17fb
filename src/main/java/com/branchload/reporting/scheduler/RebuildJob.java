package com.branchload.reporting.scheduler;

import com.branchload.reporting.entity.enums.JobStatus;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle of a submitted rebuild: status, the run it produced, and a cancel flag
 * checked by the pipeline between branches.
 */
@Getter
@ToString
public class RebuildJob {

    private final String jobId;
    private final String description;
    private final Instant submittedAt;

    private volatile JobStatus status = JobStatus.QUEUED;
    private volatile String runId;
    private volatile String error;

    @ToString.Exclude
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public RebuildJob(String jobId, String description, Instant submittedAt) {
        this.jobId = jobId;
        this.description = description;
        this.submittedAt = submittedAt;
    }

    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    void markRunning() {
        this.status = JobStatus.RUNNING;
    }

    void complete(String runId, boolean success, String error) {
        this.runId = runId;
        this.error = error;
        this.status = success ? JobStatus.SUCCESS : JobStatus.FAILED;
    }
}
