package com.branchload.reporting.scheduler;

import com.branchload.reporting.api.service.EtlOrchestrator;
import com.branchload.reporting.entity.EtlRun;
import com.branchload.reporting.entity.enums.JobStatus;
import com.branchload.reporting.entity.enums.RunStatus;
import com.branchload.reporting.tracking.EtlRunTracker;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * RebuildJobService Test - single-writer queue, outcome from the run row, cancellation
 */
@Slf4j
class RebuildJobServiceTest {

    private static final LocalDate DAY = LocalDate.of(2025, 3, 5);

    private EtlOrchestrator orchestrator;
    private EtlRunTracker tracker;
    private RebuildJobService service;

    @BeforeEach
    void setUp() {
        orchestrator = mock(EtlOrchestrator.class);
        tracker = mock(EtlRunTracker.class);
        service = new RebuildJobService(orchestrator, tracker, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void shouldCompleteJobFromSuccessfulRun() throws Exception {
        when(orchestrator.runDaily(eq(DAY), any(BooleanSupplier.class))).thenReturn("run-1");
        when(tracker.find("run-1")).thenReturn(Optional.of(run("run-1", RunStatus.SUCCESS, "")));

        RebuildJob job = service.submitDaily(DAY);
        awaitTerminal(job);

        assertThat(job.getStatus()).isEqualTo(JobStatus.SUCCESS);
        assertThat(job.getRunId()).isEqualTo("run-1");
        assertThat(job.getError()).isNull();
        assertThat(service.find(job.getJobId())).contains(job);
        assertThat(service.cancel(job.getJobId())).isFalse();
    }

    @Test
    void shouldFailJobWhenRunFailed() throws Exception {
        when(orchestrator.runFullYear(eq(2025), any(BooleanSupplier.class))).thenReturn("run-2");
        when(tracker.find("run-2")).thenReturn(Optional.of(run("run-2", RunStatus.FAILED, "\n1213086: boom")));

        RebuildJob job = service.submitFullYear(2025);
        awaitTerminal(job);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).contains("1213086: boom");
    }

    @Test
    void shouldFailJobWhenPipelineThrows() throws Exception {
        when(orchestrator.runFullYear(eq(2024), any(BooleanSupplier.class)))
                .thenThrow(new IllegalArgumentException("Year 2024 has no days to rebuild"));

        RebuildJob job = service.submitFullYear(2024);
        awaitTerminal(job);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getRunId()).isNull();
        assertThat(job.getError()).contains("no days to rebuild");
    }

    @Test
    void shouldRunJobsOneAtATimeAndHonourCancel() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(orchestrator.runDaily(eq(DAY), any(BooleanSupplier.class))).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return "run-first";
        });
        when(tracker.find("run-first")).thenReturn(Optional.of(run("run-first", RunStatus.SUCCESS, "")));

        RebuildJob first = service.submitDaily(DAY);
        RebuildJob second = service.submitDaily(DAY.plusDays(1));

        assertThat(second.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(service.cancel(second.getJobId())).isTrue();
        assertThat(service.cancel("unknown")).isFalse();

        release.countDown();
        awaitTerminal(first);
        awaitTerminal(second);

        assertThat(first.getStatus()).isEqualTo(JobStatus.SUCCESS);
        assertThat(second.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(second.getRunId()).isNull();
        assertThat(second.getError()).isEqualTo("cancelled");
        verify(orchestrator, never()).runDaily(eq(DAY.plusDays(1)), any(BooleanSupplier.class));
    }

    @Test
    void shouldKeepOnlyRecentFinishedJobs() throws Exception {
        service.shutdown();
        service = new RebuildJobService(orchestrator, tracker, Clock.systemUTC(), 2);
        when(orchestrator.runDaily(any(), any(BooleanSupplier.class))).thenReturn("run-x");
        when(tracker.find("run-x")).thenReturn(Optional.of(run("run-x", RunStatus.SUCCESS, "")));

        RebuildJob first = service.submitDaily(DAY);
        RebuildJob second = service.submitDaily(DAY.plusDays(1));
        RebuildJob third = service.submitDaily(DAY.plusDays(2));
        awaitTerminal(third);

        long deadline = System.currentTimeMillis() + 5_000;
        while (service.find(first.getJobId()).isPresent() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertThat(service.find(first.getJobId())).isEmpty();
        assertThat(service.find(second.getJobId())).contains(second);
        assertThat(service.find(third.getJobId())).contains(third);
    }

    private static EtlRun run(String runId, RunStatus status, String errorLog) {
        return EtlRun.builder().runId(runId).runType("daily").status(status).errorLog(errorLog).build();
    }

    private static void awaitTerminal(RebuildJob job) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!job.getStatus().isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(job.getStatus().isTerminal()).as("job %s finished", job.getJobId()).isTrue();
    }
}
