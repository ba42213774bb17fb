package com.branchload.reporting.processor;

import com.branchload.reporting.config.EtlConfig;
import com.branchload.reporting.entity.BranchGroups;
import com.branchload.reporting.entity.GroupHourLoad;
import com.branchload.reporting.entity.StaffGroup;
import com.branchload.reporting.entity.StaffHourFact;
import com.branchload.reporting.repository.GroupHourLoadRepository;
import com.branchload.reporting.repository.StaffHourBusyRepository;
import com.branchload.reporting.util.PeriodWindows;
import com.branchload.reporting.util.Rounding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * GroupLoadAggregator - folds busy staff hours into per-group hourly load
 *
 * Every (date, hour 0-23, group) of the window gets a row, including idle ones.
 * load_pct = busy_count / staff_total * 100 rounded to 2 decimals; 0.0 for an empty group.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupLoadAggregator {

    private static final int HOURS_PER_DAY = 24;

    private final EtlConfig etlConfig;
    private final StaffHourBusyRepository staffHourBusyRepository;
    private final GroupHourLoadRepository groupHourLoadRepository;

    private record DateHour(LocalDate date, int hour) {
    }

    /**
     * Recompute group loads from the persisted busy facts of the window; returns rows written.
     */
    @Transactional
    public int rebuild(BranchGroups branchGroups, LocalDate from, LocalDate to) {
        long branchId = branchGroups.getBranchId();
        List<StaffHourFact> facts = staffHourBusyRepository.findByBranchAndRange(branchId, from, to);
        List<GroupHourLoad> loads = aggregate(branchGroups, facts, from, to);

        int deleted = groupHourLoadRepository.deleteByBranchAndRange(branchId, from, to);
        int inserted = groupHourLoadRepository.bulkInsert(loads);

        log.info("📊 Branch {} [{}..{}]: {} groups, group loads rebuilt - {} removed, {} written",
                branchId, from, to, branchGroups.getGroups().size(), deleted, inserted);
        return inserted;
    }

    public List<GroupHourLoad> aggregate(BranchGroups branchGroups, List<StaffHourFact> facts,
                                         LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Window end " + to + " precedes start " + from);
        }

        Map<DateHour, Set<Long>> busyByHour = new HashMap<>();
        for (StaffHourFact fact : facts) {
            if (Boolean.TRUE.equals(fact.getBusy())) {
                busyByHour.computeIfAbsent(new DateHour(fact.getDate(), fact.getHour()), k -> new HashSet<>())
                        .add(fact.getStaffId());
            }
        }

        List<GroupHourLoad> loads = new ArrayList<>();
        for (LocalDate date : PeriodWindows.dateRange(from, to)) {
            int dow = date.getDayOfWeek().getValue();
            for (int hour = 0; hour < HOURS_PER_DAY; hour++) {
                Set<Long> busy = busyByHour.getOrDefault(new DateHour(date, hour), Set.of());
                for (StaffGroup group : branchGroups.getGroups()) {
                    loads.add(buildCell(branchGroups.getBranchId(), group, date, dow, hour, busy));
                }
            }
        }
        return loads;
    }

    private GroupHourLoad buildCell(long branchId, StaffGroup group, LocalDate date, int dow, int hour, Set<Long> busy) {
        int staffTotal = group.size();
        int busyCount = 0;
        if (staffTotal > 0) {
            for (Long staffId : group.getStaffIds()) {
                if (busy.contains(staffId)) busyCount++;
            }
        }
        return GroupHourLoad.builder()
                .branchId(branchId)
                .groupId(group.getGroupId())
                .date(date)
                .dow(dow)
                .hour(hour)
                .busyCount(busyCount)
                .staffTotal(staffTotal)
                .loadPct(loadPct(busyCount, staffTotal))
                .inBenchmark(etlConfig.isBenchmarkHour(hour))
                .build();
    }

    static double loadPct(int busyCount, int staffTotal) {
        if (staffTotal <= 0) {
            return 0.0;
        }
        return Rounding.round2(busyCount * 100.0 / staffTotal);
    }
}
