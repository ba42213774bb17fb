package com.branchload.reporting.service;

import com.branchload.reporting.api.service.GroupDefinitionResolver;
import com.branchload.reporting.config.ReportingConfig;
import com.branchload.reporting.entity.BranchGroups;
import com.branchload.reporting.entity.GroupHourLoad;
import com.branchload.reporting.entity.StaffGroup;
import com.branchload.reporting.repository.GroupHourLoadRepository;
import com.branchload.reporting.util.Rounding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Daily Load Provider - per-day benchmark load of a branch's load group(s), for the financial reports
 *
 * The branch code is mapped to its scheduling branch and load-group name through configuration;
 * groups match by name ignoring case and repeated whitespace. Days without rows are absent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DailyLoadProvider {

    private final ReportingConfig reportingConfig;
    private final GroupDefinitionResolver groupDefinitionResolver;
    private final GroupHourLoadRepository groupHourLoadRepository;

    public Map<LocalDate, Double> dailyLoad(String branchCode, LocalDate from, LocalDate to) {
        Map<LocalDate, Double> daily = new TreeMap<>();
        ReportingConfig.BranchSettings settings = reportingConfig.findBranch(branchCode).orElse(null);
        if (settings == null || settings.getSchedulingBranchId() == null || settings.getLoadGroupName() == null) {
            return daily;
        }

        long branchId = settings.getSchedulingBranchId();
        BranchGroups groups = groupDefinitionResolver.loadResolved(branchId);
        String target = normalizeName(settings.getLoadGroupName());

        Map<LocalDate, List<Double>> byDate = new TreeMap<>();
        for (StaffGroup group : groups.getGroups()) {
            if (!normalizeName(group.getName()).equals(target)) continue;
            for (GroupHourLoad row : groupHourLoadRepository.findBenchmarkByGroupAndRange(branchId, group.getGroupId(), from, to)) {
                byDate.computeIfAbsent(row.getDate(), d -> new ArrayList<>()).add(row.getLoadPct());
            }
        }

        byDate.forEach((date, values) -> daily.put(date,
                Rounding.round2(values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0))));
        log.debug("Branch {}: load for {} day(s) in [{}..{}]", branchCode, daily.size(), from, to);
        return daily;
    }

    static String normalizeName(String value) {
        if (value == null) return "";
        return String.join(" ", value.toLowerCase(Locale.ROOT).replace('ё', 'е').trim().split("\\s+"));
    }
}
