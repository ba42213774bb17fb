package com.branchload.reporting.service;

import com.branchload.reporting.api.service.GroupDefinitionResolver;
import com.branchload.reporting.config.EtlConfig;
import com.branchload.reporting.dto.report.HeatmapCell;
import com.branchload.reporting.dto.report.HeatmapDay;
import com.branchload.reporting.dto.report.HeatmapGrid;
import com.branchload.reporting.dto.report.MonthLoadSummary;
import com.branchload.reporting.dto.report.WeekLoad;
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

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Heatmap Query Service - read side of the occupancy pipeline
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HeatmapQueryService {

    private final EtlConfig etlConfig;
    private final GroupDefinitionResolver groupDefinitionResolver;
    private final GroupHourLoadRepository groupHourLoadRepository;
    private final StaffHourBusyRepository staffHourBusyRepository;

    private record DateHour(LocalDate date, int hour) {
    }

    public List<StaffGroup> groups(long branchId) {
        return groupDefinitionResolver.loadResolved(branchId).getGroups();
    }

    /**
     * Benchmark hours x 7 days starting at weekStart. Missing cells are zero with the group size as staff total.
     */
    public HeatmapGrid weekGrid(long branchId, String groupId, LocalDate weekStart) {
        StaffGroup group = requireGroup(branchId, groupId);
        LocalDate weekEnd = weekStart.plusDays(6);
        int startHour = etlConfig.getBenchmarkStartHour();
        int endHour = etlConfig.getBenchmarkEndHour();
        List<Integer> hours = IntStream.rangeClosed(startHour, endHour).boxed().toList();

        Map<DateHour, GroupHourLoad> byDateHour = new HashMap<>();
        for (GroupHourLoad row : groupHourLoadRepository.findByGroupAndRange(branchId, groupId, weekStart, weekEnd)) {
            if (row.getHour() >= startHour && row.getHour() <= endHour) {
                byDateHour.put(new DateHour(row.getDate(), row.getHour()), row);
            }
        }

        Map<LocalDate, boolean[]> gray = new HashMap<>();
        for (StaffHourFact fact : staffHourBusyRepository.findGrayBusy(branchId, group.getStaffIds(), weekStart, weekEnd)) {
            boolean[] flags = gray.computeIfAbsent(fact.getDate(), d -> new boolean[2]);
            if (fact.getHour() < startHour) flags[0] = true;
            if (fact.getHour() > endHour) flags[1] = true;
        }

        List<HeatmapDay> days = new ArrayList<>();
        for (LocalDate day : PeriodWindows.dateRange(weekStart, weekEnd)) {
            List<HeatmapCell> cells = new ArrayList<>();
            for (int hour : hours) {
                GroupHourLoad row = byDateHour.get(new DateHour(day, hour));
                cells.add(row != null
                        ? HeatmapCell.builder().date(day).hour(hour).loadPct(row.getLoadPct())
                                .busyCount(row.getBusyCount()).staffTotal(row.getStaffTotal()).build()
                        : HeatmapCell.builder().date(day).hour(hour).loadPct(0.0)
                                .busyCount(0).staffTotal(group.size()).build());
            }
            boolean[] flags = gray.getOrDefault(day, new boolean[2]);
            days.add(HeatmapDay.builder()
                    .date(day)
                    .dow(day.getDayOfWeek().getValue())
                    .cells(cells)
                    .early(flags[0])
                    .late(flags[1])
                    .build());
        }

        return HeatmapGrid.builder()
                .branchId(branchId)
                .groupId(groupId)
                .groupName(group.getName())
                .weekStart(weekStart)
                .hours(hours)
                .days(days)
                .build();
    }

    /**
     * Daily, weekly (Monday weeks clipped to the month) and monthly averages of benchmark load.
     */
    public MonthLoadSummary monthSummary(long branchId, String groupId, YearMonth month) {
        requireGroup(branchId, groupId);
        PeriodWindows.Window window = PeriodWindows.monthWindow(month);

        Map<LocalDate, List<Double>> byDate = new HashMap<>();
        List<Double> all = new ArrayList<>();
        for (GroupHourLoad row : groupHourLoadRepository.findBenchmarkByGroupAndRange(
                branchId, groupId, window.start(), window.end())) {
            byDate.computeIfAbsent(row.getDate(), d -> new ArrayList<>()).add(row.getLoadPct());
            all.add(row.getLoadPct());
        }

        Map<LocalDate, Double> daily = new LinkedHashMap<>();
        for (LocalDate day : window.days()) {
            daily.put(day, averageOrZero(byDate.getOrDefault(day, List.of())));
        }

        List<WeekLoad> weekly = new ArrayList<>();
        for (LocalDate weekStart : PeriodWindows.weekStartsCovering(month)) {
            List<Double> values = new ArrayList<>();
            for (LocalDate day : PeriodWindows.dateRange(weekStart, weekStart.plusDays(6))) {
                if (window.contains(day)) {
                    values.addAll(byDate.getOrDefault(day, List.of()));
                }
            }
            weekly.add(new WeekLoad(weekStart, averageOrZero(values)));
        }

        return MonthLoadSummary.builder()
                .branchId(branchId)
                .groupId(groupId)
                .month(month)
                .dailyAverages(daily)
                .weeklyAverages(weekly)
                .monthAverage(averageOrZero(all))
                .build();
    }

    public List<LocalDate> weeksOfMonth(YearMonth month) {
        return PeriodWindows.weekStartsCovering(month);
    }

    private StaffGroup requireGroup(long branchId, String groupId) {
        return groupDefinitionResolver.loadResolved(branchId).findGroup(groupId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown group " + groupId + " for branch " + branchId));
    }

    private static double averageOrZero(List<Double> values) {
        if (values.isEmpty()) return 0.0;
        return Rounding.round2(values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));
    }
}
