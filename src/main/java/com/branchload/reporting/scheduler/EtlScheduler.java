package com.branchload.reporting.scheduler;

import com.branchload.reporting.api.service.EtlOrchestrator;
import com.branchload.reporting.config.EtlConfig;
import com.branchload.reporting.repository.GroupHourLoadRepository;
import com.branchload.reporting.repository.RawRecordRepository;
import com.branchload.reporting.repository.StaffHourBusyRepository;
import com.branchload.reporting.tracking.EtlRunTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * EtlScheduler - triggers the daily occupancy rebuild
 * Runs go through the rebuild queue, so a manual rebuild and the cron never overlap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EtlScheduler {

    private final RebuildJobService rebuildJobService;
    private final EtlOrchestrator etlOrchestrator;
    private final EtlConfig etlConfig;
    private final EtlRunTracker etlRunTracker;
    private final RawRecordRepository rawRecordRepository;
    private final StaffHourBusyRepository staffHourBusyRepository;
    private final GroupHourLoadRepository groupHourLoadRepository;

    // ================================
    // SCHEDULED REBUILD
    // ================================

    @Scheduled(cron = "${etl.daily-cron:0 0 6 * * *}", zone = "${etl.timezone:Europe/Moscow}")
    public void scheduledDailyRebuild() {
        log.info("╔════════════════════════════════════════════════════════════╗");
        log.info("║              SCHEDULED DAILY REBUILD TRIGGERED             ║");
        log.info("╚════════════════════════════════════════════════════════════╝");

        RebuildJob job = rebuildJobService.submitDaily(null);
        log.info("   Job {} queued for yesterday ({})", job.getJobId(), etlConfig.getTimezone());
    }

    // ================================
    // MANUAL REBUILD
    // ================================

    public RebuildJob triggerDaily(LocalDate day) {
        log.info("╔════════════════════════════════════════════════════════════╗");
        log.info("║               MANUAL DAILY REBUILD TRIGGERED               ║");
        log.info("╚════════════════════════════════════════════════════════════╝");
        return rebuildJobService.submitDaily(day);
    }

    public RebuildJob triggerFullYear(Integer year) {
        int target = year != null ? year
                : etlConfig.getFullRebuildYear() != null ? etlConfig.getFullRebuildYear() : LocalDate.now(etlConfig.getZoneId()).getYear();
        log.info("╔════════════════════════════════════════════════════════════╗");
        log.info("║             MANUAL FULL-YEAR REBUILD TRIGGERED             ║");
        log.info("╚════════════════════════════════════════════════════════════╝");
        log.info("   Year: {}", target);
        return rebuildJobService.submitFullYear(target);
    }

    // ================================
    // STARTUP HOOK
    // ================================

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("╔════════════════════════════════════════════════════════════╗");
        log.info("║          APPLICATION READY - SCHEDULER INITIALIZED         ║");
        log.info("╚════════════════════════════════════════════════════════════╝");
        log.info("📋 Daily cron: {} ({})", etlConfig.getDailyCron(), etlConfig.getTimezone());
        log.info("📋 Benchmark hours: {}-{}", etlConfig.getBenchmarkStartHour(), etlConfig.getBenchmarkEndHour());
        log.info("📋 Active branches: {}", etlOrchestrator.activeBranchIds());
        logStoreStatus();
    }

    /**
     * Row counts per active branch and the last successful daily run.
     */
    public void logStoreStatus() {
        for (Long branchId : etlOrchestrator.activeBranchIds()) {
            log.info("   Branch {}: {} raw records, {} busy hours, {} group-hour rows",
                    branchId,
                    rawRecordRepository.countByBranch(branchId),
                    staffHourBusyRepository.countByBranch(branchId),
                    groupHourLoadRepository.countByBranch(branchId));
        }
        etlRunTracker.lastSuccessful(EtlOrchestrator.RUN_TYPE_DAILY).ifPresentOrElse(
                run -> log.info("   Last successful daily run: {} at {}", run.getRunId(), run.getFinishedAt()),
                () -> log.info("   No successful daily run yet"));
    }
}
