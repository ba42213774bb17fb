package com.branchload.reporting.tracking;

import com.branchload.reporting.entity.EtlRun;
import com.branchload.reporting.entity.enums.RunStatus;
import com.branchload.reporting.repository.EtlRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * EtlRunTracker - sole writer of etl_runs rows
 *
 * running -> success | failed. Progress is overwritten, errors accumulate,
 * finished_at is stamped once on the terminal transition.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EtlRunTracker {

    private final EtlRunRepository etlRunRepository;
    private final Clock clock;

    public String start(String runType) {
        EtlRun run = EtlRun.builder()
                .runId(UUID.randomUUID().toString())
                .runType(runType)
                .startedAt(Instant.now(clock))
                .build();
        etlRunRepository.insert(run);
        log.info("🚀 Run {} ({}) started", run.getRunId(), runType);
        return run.getRunId();
    }

    public void updateProgress(String runId, String progress) {
        if (etlRunRepository.updateProgress(runId, progress) == 0) {
            log.debug("Progress ignored for closed or unknown run {}", runId);
        }
    }

    public void appendError(String runId, String error) {
        if (etlRunRepository.appendError(runId, error) == 0) {
            log.warn("⚠️ Error ignored for closed or unknown run {}: {}", runId, error);
            return;
        }
        log.warn("⚠️ Run {}: {}", runId, error);
    }

    public boolean markSuccess(String runId) {
        return finish(runId, RunStatus.SUCCESS, "100%", null);
    }

    public boolean markFailed(String runId, String error) {
        return finish(runId, RunStatus.FAILED, null, error != null && !error.isBlank() ? error : null);
    }

    public Optional<EtlRun> find(String runId) {
        return etlRunRepository.findById(runId);
    }

    public List<EtlRun> recentRuns(int limit) {
        return etlRunRepository.findRecent(limit);
    }

    public Optional<EtlRun> lastSuccessful(String runType) {
        return etlRunRepository.findLatestSuccessful(runType);
    }

    private boolean finish(String runId, RunStatus status, String progress, String finalError) {
        boolean changed = etlRunRepository.finish(runId, status, progress, finalError, Instant.now(clock)) > 0;
        if (changed) {
            log.info("🏁 Run {} finished: {}", runId, status.dbValue());
        } else {
            log.warn("⚠️ Run {} already terminal or unknown, {} ignored", runId, status.dbValue());
        }
        return changed;
    }
}
