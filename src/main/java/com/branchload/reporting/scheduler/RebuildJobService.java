package com.branchload.reporting.scheduler;

import com.branchload.reporting.api.service.EtlOrchestrator;
import com.branchload.reporting.entity.EtlRun;
import com.branchload.reporting.entity.enums.RunStatus;
import com.branchload.reporting.tracking.EtlRunTracker;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Rebuild Job Service - single-writer queue for pipeline runs
 * Jobs execute one at a time in submission order. Only the most recent finished jobs stay
 * queryable; queued and running jobs are always kept.
 */
@Service
@Slf4j
public class RebuildJobService {

    static final int DEFAULT_RETAINED_FINISHED_JOBS = 100;
    static final String CANCELLED = "cancelled";

    private final EtlOrchestrator etlOrchestrator;
    private final EtlRunTracker etlRunTracker;
    private final Clock clock;

    private final ExecutorService executorService = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "rebuild-writer");
        thread.setDaemon(true);
        return thread;
    });
    private final Map<String, RebuildJob> jobs = new ConcurrentHashMap<>();
    private final Deque<String> finishedJobIds = new ConcurrentLinkedDeque<>();
    private final int retainedFinishedJobs;

    @Autowired
    public RebuildJobService(EtlOrchestrator etlOrchestrator, EtlRunTracker etlRunTracker, Clock clock) {
        this(etlOrchestrator, etlRunTracker, clock, DEFAULT_RETAINED_FINISHED_JOBS);
    }

    RebuildJobService(EtlOrchestrator etlOrchestrator, EtlRunTracker etlRunTracker, Clock clock,
                      int retainedFinishedJobs) {
        this.etlOrchestrator = etlOrchestrator;
        this.etlRunTracker = etlRunTracker;
        this.clock = clock;
        this.retainedFinishedJobs = retainedFinishedJobs;
    }

    public RebuildJob submitDaily(LocalDate day) {
        return submit("daily " + (day != null ? day : "yesterday"),
                job -> etlOrchestrator.runDaily(day, job::isCancelRequested));
    }

    public RebuildJob submitFullYear(int year) {
        return submit("full year " + year,
                job -> etlOrchestrator.runFullYear(year, job::isCancelRequested));
    }

    public Optional<RebuildJob> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public boolean cancel(String jobId) {
        RebuildJob job = jobs.get(jobId);
        if (job == null || job.getStatus().isTerminal()) {
            return false;
        }
        job.cancel();
        log.warn("⚠️ Cancellation requested for job {} ({})", jobId, job.getDescription());
        return true;
    }

    private RebuildJob submit(String description, Function<RebuildJob, String> work) {
        RebuildJob job = new RebuildJob(UUID.randomUUID().toString(), description, Instant.now(clock));
        jobs.put(job.getJobId(), job);
        log.info("📋 Job {} queued: {}", job.getJobId(), description);
        executorService.submit(() -> execute(job, work));
        return job;
    }

    private void execute(RebuildJob job, Function<RebuildJob, String> work) {
        if (job.isCancelRequested()) {
            log.warn("⚠️ Job {} cancelled while queued, not started", job.getJobId());
            job.complete(null, false, CANCELLED);
            retire(job);
            return;
        }
        job.markRunning();
        log.info("🚀 Job {} running: {}", job.getJobId(), job.getDescription());
        try {
            String runId = work.apply(job);
            Optional<EtlRun> run = etlRunTracker.find(runId);
            boolean success = run.map(r -> r.getStatus() == RunStatus.SUCCESS).orElse(false);
            job.complete(runId, success, run.map(EtlRun::getErrorLog).filter(s -> !s.isBlank()).orElse(null));
            log.info("🏁 Job {} finished: {} (run {})", job.getJobId(), job.getStatus(), runId);
        } catch (RuntimeException e) {
            log.error("❌ Job {} failed: {}", job.getJobId(), e.getMessage(), e);
            job.complete(null, false, e.toString());
        }
        retire(job);
    }

    /**
     * Drops the oldest finished jobs beyond the retention limit.
     */
    private void retire(RebuildJob job) {
        finishedJobIds.addLast(job.getJobId());
        while (finishedJobIds.size() > retainedFinishedJobs) {
            String oldest = finishedJobIds.pollFirst();
            if (oldest == null) break;
            jobs.remove(oldest);
            log.debug("Job {} dropped from history", oldest);
        }
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
