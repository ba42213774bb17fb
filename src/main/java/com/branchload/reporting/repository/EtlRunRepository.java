package com.branchload.reporting.repository;

import com.branchload.reporting.entity.EtlRun;
import com.branchload.reporting.entity.enums.RunStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * ETL Run Repository - audit rows for every pipeline run
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class EtlRunRepository {

    private final JdbcTemplate jdbcTemplate;

    public void insert(EtlRun run) {
        String sql = """
            INSERT INTO etl_runs (run_id, run_type, started_at, finished_at, status, progress, error_log)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql,
                run.getRunId(), run.getRunType(), toOffset(run.getStartedAt()), toOffset(run.getFinishedAt()),
                run.getStatus().dbValue(), run.getProgress(), run.getErrorLog());
    }

    /**
     * Progress is only written while the run is still open
     */
    public int updateProgress(String runId, String progress) {
        return jdbcTemplate.update(
                "UPDATE etl_runs SET progress = ? WHERE run_id = ? AND status = ?",
                progress, runId, RunStatus.RUNNING.dbValue());
    }

    /**
     * Errors are only appended while the run is still open
     */
    public int appendError(String runId, String line) {
        return jdbcTemplate.update(
                "UPDATE etl_runs SET error_log = COALESCE(error_log, '') || ? WHERE run_id = ? AND status = ?",
                "\n" + line, runId, RunStatus.RUNNING.dbValue());
    }

    /**
     * Moves a running row to a terminal status, appending {@code finalError} in the same statement.
     * A row that is already terminal is left as is.
     *
     * @return 1 when the transition happened, 0 otherwise
     */
    public int finish(String runId, RunStatus status, String progress, String finalError, Instant finishedAt) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        String sql = """
            UPDATE etl_runs SET status = ?, finished_at = ?,
                progress = COALESCE(CAST(? AS VARCHAR(255)), progress),
                error_log = COALESCE(error_log, '') || ?
            WHERE run_id = ? AND status = ?
            """;
        String suffix = finalError != null ? "\n" + finalError : "";
        return jdbcTemplate.update(sql, status.dbValue(), toOffset(finishedAt), progress, suffix,
                runId, RunStatus.RUNNING.dbValue());
    }

    public Optional<EtlRun> findById(String runId) {
        List<EtlRun> rows = jdbcTemplate.query("SELECT * FROM etl_runs WHERE run_id = ?", rowMapper(), runId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<EtlRun> findRecent(int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM etl_runs ORDER BY started_at DESC LIMIT ?", rowMapper(), limit);
    }

    public Optional<EtlRun> findLatestSuccessful(String runType) {
        List<EtlRun> rows = jdbcTemplate.query(
                "SELECT * FROM etl_runs WHERE run_type = ? AND status = ? ORDER BY finished_at DESC LIMIT 1",
                rowMapper(), runType, RunStatus.SUCCESS.dbValue());
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    private RowMapper<EtlRun> rowMapper() {
        return (rs, rowNum) -> {
            OffsetDateTime started = rs.getObject("started_at", OffsetDateTime.class);
            OffsetDateTime finished = rs.getObject("finished_at", OffsetDateTime.class);
            String errorLog = rs.getString("error_log");
            return EtlRun.builder()
                    .runId(rs.getString("run_id"))
                    .runType(rs.getString("run_type"))
                    .startedAt(started != null ? started.toInstant() : null)
                    .finishedAt(finished != null ? finished.toInstant() : null)
                    .status(RunStatus.fromString(rs.getString("status")))
                    .progress(rs.getString("progress"))
                    .errorLog(errorLog != null ? errorLog : "")
                    .build();
        };
    }
}
