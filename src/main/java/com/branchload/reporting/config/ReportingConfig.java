package com.branchload.reporting.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reporting Configuration - financial engine thresholds and branch directory
 *
 * Usage in application.yml:
 * reporting:
 *   store: h2
 *   cash-threshold: 1000
 *   branches:
 *     - code: SM
 *       name: Main street
 *       scheduling-branch-id: 1213086
 *       load-group-name: Workstation
 */
@Configuration
@ConfigurationProperties(prefix = "reporting")
@Data
public class ReportingConfig {

    /** Persistence backend: h2 or postgres */
    private String store = "h2";

    private double cashThreshold = 1000.0;

    private double writeoffAlertRate = 0.10;

    private double revenueDropRatio = 0.9;

    private int trailingWeeks = 8;

    private int topDrivers = 3;

    private int maxAlerts = 3;

    private Duration cacheTtl = Duration.ofMinutes(5);

    private List<BranchSettings> branches = new ArrayList<>();

    @Data
    public static class BranchSettings {
        private String code;
        private String name;
        private Long schedulingBranchId;
        private String loadGroupName;
    }

    public Optional<BranchSettings> findBranch(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return branches.stream()
                .filter(b -> code.equalsIgnoreCase(b.getCode()))
                .findFirst();
    }
}
