package com.branchload.reporting.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * ETL Configuration - occupancy pipeline settings
 *
 * Usage in application.yml:
 * etl:
 *   timezone: Europe/Moscow
 *   benchmark-start-hour: 10
 *   benchmark-end-hour: 21
 *   page-size: 50
 *   active-branch-ids: [1213086]
 */
@Configuration
@ConfigurationProperties(prefix = "etl")
@Data
public class EtlConfig {

    private String timezone = "Europe/Moscow";

    /** First hour (inclusive) counted toward benchmark utilization. */
    private int benchmarkStartHour = 10;

    /** Last hour (inclusive) counted toward benchmark utilization. */
    private int benchmarkEndHour = 21;

    private int pageSize = 50;

    private List<Long> activeBranchIds = new ArrayList<>();

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate branchStartDate;

    private String groupConfigPath = "config/groups.json";

    private String groupResolvedPath = "config/groups_resolved.json";

    private String dailyCron = "0 0 6 * * *";

    /** Year rebuilt by a full run when the caller does not name one; null means the current year. */
    private Integer fullRebuildYear;

    // Convenience methods
    public ZoneId getZoneId() {
        return ZoneId.of(timezone);
    }

    public boolean isBenchmarkHour(int hour) {
        return hour >= benchmarkStartHour && hour <= benchmarkEndHour;
    }

    public boolean isBranchActive(long branchId) {
        return activeBranchIds == null || activeBranchIds.isEmpty() || activeBranchIds.contains(branchId);
    }
}
