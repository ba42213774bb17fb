package com.branchload.reporting.service;

import com.branchload.reporting.analytics.MetricCatalog;
import com.branchload.reporting.cache.TtlCache;
import com.branchload.reporting.config.EtlConfig;
import com.branchload.reporting.config.ReportingConfig;
import com.branchload.reporting.entity.Branch;
import com.branchload.reporting.entity.DailyMetricFact;
import com.branchload.reporting.entity.MetricDefinition;
import com.branchload.reporting.entity.MonthlyPlan;
import com.branchload.reporting.repository.BranchRepository;
import com.branchload.reporting.repository.DailyMetricRepository;
import com.branchload.reporting.repository.MetricRepository;
import com.branchload.reporting.repository.MonthlyPlanRepository;
import com.branchload.reporting.util.PeriodWindows;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Financial Fact Service - write side of the daily sheet and plans, branch and metric directory
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FinancialFactService {

    private static final String ALL_KEY = "all";

    private final DailyMetricRepository dailyMetricRepository;
    private final MonthlyPlanRepository monthlyPlanRepository;
    private final BranchRepository branchRepository;
    private final MetricRepository metricRepository;
    private final ReportingConfig reportingConfig;
    private final EtlConfig etlConfig;
    private final Clock clock;
    private final TtlCache<String, List<Branch>> branchDirectoryCache;
    private final TtlCache<String, List<MetricDefinition>> metricCatalogCache;

    // ================================
    // DIRECTORY SEEDING
    // ================================

    @EventListener(ApplicationReadyEvent.class)
    public void seedDirectory() {
        List<Branch> configured = reportingConfig.getBranches().stream()
                .filter(b -> b.getCode() != null)
                .map(b -> new Branch(normalizeBranchCode(b.getCode()), b.getName() != null ? b.getName() : b.getCode()))
                .toList();
        int branches = branchRepository.upsertAll(configured);
        int metrics = metricRepository.upsertAll(MetricCatalog.MONTHLY_REPORT_METRICS);
        branchDirectoryCache.invalidateAll();
        metricCatalogCache.invalidateAll();
        log.info("📋 Directory seeded: {} branches, {} metrics", branches, metrics);
    }

    // ================================
    // WRITE SIDE
    // ================================

    public int upsertDailyFacts(List<DailyMetricFact> facts) {
        List<DailyMetricFact> normalized = new ArrayList<>(facts.size());
        for (DailyMetricFact fact : facts) {
            if (fact.getDate() == null || isBlank(fact.getBranchCode()) || isBlank(fact.getMetricCode())) {
                throw new IllegalArgumentException("Daily fact needs branch, metric and date: " + fact);
            }
            normalized.add(DailyMetricFact.builder()
                    .branchCode(normalizeBranchCode(fact.getBranchCode()))
                    .metricCode(fact.getMetricCode().trim())
                    .date(fact.getDate())
                    .value(fact.getValue())
                    .source(fact.getSource() != null ? fact.getSource() : "manual")
                    .build());
        }
        int written = dailyMetricRepository.upsertAll(normalized);
        branchDirectoryCache.invalidateAll();
        log.info("💾 Upserted {} daily facts", written);
        return written;
    }

    public int upsertDailyFact(String branchCode, String metricCode, LocalDate date, Double value) {
        return upsertDailyFacts(List.of(DailyMetricFact.builder()
                .branchCode(branchCode)
                .metricCode(metricCode)
                .date(date)
                .value(value)
                .build()));
    }

    public void upsertPlan(String branchCode, String month, String metricCode, double value) {
        if (isBlank(branchCode) || isBlank(metricCode)) {
            throw new IllegalArgumentException("Plan needs branch and metric");
        }
        YearMonth yearMonth = PeriodWindows.parseMonth(month);
        monthlyPlanRepository.upsertAll(List.of(MonthlyPlan.builder()
                .branchCode(normalizeBranchCode(branchCode))
                .metricCode(metricCode.trim())
                .monthStart(yearMonth.atDay(1))
                .value(value)
                .build()));
        log.info("💾 Plan {} {} {} = {}", branchCode, month, metricCode, value);
    }

    // ================================
    // DIRECTORY READS
    // ================================

    /**
     * Branches from the directory table, the configuration and the fact sheet, sorted by name.
     */
    public List<Branch> listBranches() {
        return branchDirectoryCache.getOrLoad(ALL_KEY, () -> {
            Map<String, Branch> branches = new LinkedHashMap<>();
            branchRepository.findAll().forEach(b -> branches.put(b.getCode(), b));
            for (ReportingConfig.BranchSettings settings : reportingConfig.getBranches()) {
                if (settings.getCode() == null) continue;
                String code = normalizeBranchCode(settings.getCode());
                branches.putIfAbsent(code, new Branch(code, settings.getName() != null ? settings.getName() : code));
            }
            for (String code : dailyMetricRepository.findBranchCodes()) {
                branches.putIfAbsent(code, new Branch(code, code));
            }
            List<Branch> sorted = new ArrayList<>(branches.values());
            sorted.sort(Comparator.comparing(Branch::getName).thenComparing(Branch::getCode));
            return List.copyOf(sorted);
        });
    }

    public Branch branch(String branchCode) {
        String code = normalizeBranchCode(branchCode);
        return listBranches().stream()
                .filter(b -> b.getCode().equals(code))
                .findFirst()
                .orElseGet(() -> new Branch(code, code));
    }

    /**
     * Months with facts, newest first, never later than the current month.
     */
    public List<YearMonth> listMonths(String branchCode) {
        YearMonth current = YearMonth.now(clock.withZone(etlConfig.getZoneId()));
        return dailyMetricRepository.findMonths(normalizeBranchCode(branchCode)).stream()
                .filter(m -> !m.isAfter(current))
                .toList();
    }

    public List<MetricDefinition> metricCatalog() {
        return metricCatalogCache.getOrLoad(ALL_KEY, () -> {
            List<MetricDefinition> stored = metricRepository.findAll();
            return stored.isEmpty() ? MetricCatalog.MONTHLY_REPORT_METRICS : List.copyOf(stored);
        });
    }

    public String metricLabel(String metricCode) {
        Optional<MetricDefinition> metric = metricCatalog().stream()
                .filter(m -> m.getCode().equals(metricCode))
                .findFirst();
        return metric.map(MetricDefinition::getLabel).orElse(metricCode);
    }

    public static String normalizeBranchCode(String branchCode) {
        if (branchCode == null || branchCode.isBlank()) {
            throw new IllegalArgumentException("Branch code is required");
        }
        return branchCode.trim().toUpperCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
