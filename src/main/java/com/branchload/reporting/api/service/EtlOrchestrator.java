package com.branchload.reporting.api.service;

import com.branchload.reporting.config.EtlConfig;
import com.branchload.reporting.config.ReportingConfig;
import com.branchload.reporting.dto.platform.RawBookingDto;
import com.branchload.reporting.entity.BranchGroups;
import com.branchload.reporting.entity.VisitInterval;
import com.branchload.reporting.mapper.VisitRecordNormalizer;
import com.branchload.reporting.processor.GroupLoadAggregator;
import com.branchload.reporting.processor.HourlyOccupancyBuilder;
import com.branchload.reporting.repository.RawRecordRepository;
import com.branchload.reporting.tracking.EtlRunTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * EtlOrchestrator - occupancy pipeline driver
 *
 * FLOW per active branch:
 * 1. collect bookings page by page
 * 2. normalize into visit intervals, upsert raw_records
 * 3. rebuild staff_hour_busy, then group_hour_load (under the branch lock)
 *
 * A failing branch is logged into the run's error_log and the next branch continues;
 * the run ends failed if any branch failed. Returns the run id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EtlOrchestrator {

    public static final String RUN_TYPE_DAILY = "daily";
    public static final String RUN_TYPE_FULL_YEAR = "full_year";

    private final BookingCollector bookingCollector;
    private final VisitRecordNormalizer visitRecordNormalizer;
    private final RawRecordRepository rawRecordRepository;
    private final HourlyOccupancyBuilder hourlyOccupancyBuilder;
    private final GroupLoadAggregator groupLoadAggregator;
    private final GroupDefinitionResolver groupDefinitionResolver;
    private final BranchRebuildLocks branchRebuildLocks;
    private final EtlRunTracker etlRunTracker;
    private final EtlConfig etlConfig;
    private final ReportingConfig reportingConfig;
    private final Clock clock;

    // ================================
    // PUBLIC API
    // ================================

    public String runDaily(LocalDate day) {
        return runDaily(day, () -> false);
    }

    /**
     * Rebuild a single day; null means yesterday in the configured timezone.
     */
    public String runDaily(LocalDate day, BooleanSupplier cancelled) {
        LocalDate target = day != null ? day : LocalDate.now(clock.withZone(etlConfig.getZoneId())).minusDays(1);
        return execute(RUN_TYPE_DAILY, target, target, cancelled);
    }

    public String runFullYear(int year) {
        return runFullYear(year, () -> false);
    }

    /**
     * Rebuild a calendar year, clamped to the branch start date and to today.
     */
    public String runFullYear(int year, BooleanSupplier cancelled) {
        LocalDate from = LocalDate.of(year, 1, 1);
        LocalDate to = LocalDate.of(year, 12, 31);
        LocalDate startDate = etlConfig.getBranchStartDate();
        if (startDate != null && startDate.isAfter(from)) {
            from = startDate;
        }
        LocalDate today = LocalDate.now(clock.withZone(etlConfig.getZoneId()));
        if (today.isBefore(to)) {
            to = today;
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Year " + year + " has no days to rebuild after " + from);
        }
        return execute(RUN_TYPE_FULL_YEAR, from, to, cancelled);
    }

    /**
     * Branch ids the pipeline covers: explicit active ids, else every configured branch.
     */
    public List<Long> activeBranchIds() {
        List<Long> active = etlConfig.getActiveBranchIds();
        if (active != null && !active.isEmpty()) {
            return List.copyOf(active);
        }
        return reportingConfig.getBranches().stream()
                .map(ReportingConfig.BranchSettings::getSchedulingBranchId)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
    }

    // ================================
    // CORE EXECUTION
    // ================================

    private String execute(String runType, LocalDate from, LocalDate to, BooleanSupplier cancelled) {
        String runId = etlRunTracker.start(runType);
        long startTime = System.currentTimeMillis();
        log.info("📅 Run {} ({}) window {}..{}", runId, runType, from, to);

        try {
            List<Long> branchIds = activeBranchIds();
            if (branchIds.isEmpty()) {
                etlRunTracker.markFailed(runId, "no active branches configured");
                return runId;
            }

            Map<Long, BranchGroups> groupsByBranch = groupDefinitionResolver.resolveAll(branchIds);
            int failedBranches = 0;

            for (Long branchId : branchIds) {
                if (cancelled.getAsBoolean()) {
                    log.warn("⚠️ Run {} cancelled before branch {}", runId, branchId);
                    etlRunTracker.markFailed(runId, "cancelled");
                    return runId;
                }
                try {
                    processBranch(runId, branchId, groupsByBranch.get(branchId), from, to);
                } catch (RuntimeException e) {
                    failedBranches++;
                    log.error("❌ Run {} branch {} failed: {}", runId, branchId, e.getMessage(), e);
                    etlRunTracker.appendError(runId, branchId + ": " + e.getMessage());
                }
            }

            if (failedBranches > 0) {
                etlRunTracker.markFailed(runId, failedBranches + " of " + branchIds.size() + " branches failed");
            } else {
                etlRunTracker.markSuccess(runId);
            }
        } catch (RuntimeException e) {
            log.error("❌ Run {} failed: {}", runId, e.getMessage(), e);
            etlRunTracker.markFailed(runId, e.toString());
        }

        log.info("✅ Run {} done in {} ms", runId, System.currentTimeMillis() - startTime);
        return runId;
    }

    private void processBranch(String runId, long branchId, BranchGroups groups, LocalDate from, LocalDate to) {
        List<RawBookingDto> bookings = bookingCollector.collect(branchId, from, to,
                progress -> etlRunTracker.updateProgress(runId, progress));

        List<VisitInterval> intervals = visitRecordNormalizer.normalize(branchId, bookings);
        rawRecordRepository.bulkUpsert(intervals);

        BranchGroups branchGroups = groups != null ? groups : new BranchGroups(branchId, String.valueOf(branchId), List.of());
        branchRebuildLocks.withLock(branchId, () -> {
            hourlyOccupancyBuilder.rebuild(branchId, from, to, intervals);
            return groupLoadAggregator.rebuild(branchGroups, from, to);
        });
        etlRunTracker.updateProgress(runId, branchId + ": done");
    }
}
