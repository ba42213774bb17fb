package com.branchload.reporting.processor;

import com.branchload.reporting.config.EtlConfig;
import com.branchload.reporting.entity.StaffHourFact;
import com.branchload.reporting.entity.VisitInterval;
import com.branchload.reporting.entity.enums.AttendanceClass;
import com.branchload.reporting.repository.StaffHourBusyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * HourlyOccupancyBuilder - expands visit intervals into per-staff busy hours
 *
 * PATTERN: full replace per (branch, date range) - delete then bulk insert
 * - every hour from floor(start) up to (not including) end is busy
 * - overlapping visits of one staff member collapse to a single busy hour
 * - hours outside the window are ignored
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HourlyOccupancyBuilder {

    private final EtlConfig etlConfig;
    private final StaffHourBusyRepository staffHourBusyRepository;

    private record SlotKey(long staffId, LocalDate date, int hour) {
    }

    private static final Comparator<SlotKey> SLOT_ORDER = Comparator
            .comparing(SlotKey::date)
            .thenComparingInt(SlotKey::hour)
            .thenComparingLong(SlotKey::staffId);

    /**
     * Rebuild busy facts for the branch and window; returns rows written.
     */
    @Transactional
    public int rebuild(long branchId, LocalDate from, LocalDate to, List<VisitInterval> intervals) {
        List<StaffHourFact> facts = buildFacts(branchId, intervals, from, to);

        int deleted = staffHourBusyRepository.deleteByBranchAndRange(branchId, from, to);
        int inserted = staffHourBusyRepository.bulkInsert(facts);

        log.info("⏱️ Branch {} [{}..{}]: staff hours rebuilt - {} removed, {} written",
                branchId, from, to, deleted, inserted);
        return inserted;
    }

    public List<StaffHourFact> buildFacts(long branchId, List<VisitInterval> intervals, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Window end " + to + " precedes start " + from);
        }
        if (intervals == null || intervals.isEmpty()) {
            return List.of();
        }

        ZoneId zone = etlConfig.getZoneId();
        Map<SlotKey, Boolean> slots = new TreeMap<>(SLOT_ORDER);

        for (VisitInterval interval : intervals) {
            if (interval.getAttendanceClass() != AttendanceClass.FACT || interval.getStaffId() == null) {
                continue;
            }
            ZonedDateTime start = interval.getStart().withZoneSameInstant(zone);
            ZonedDateTime end = interval.getEnd().withZoneSameInstant(zone);

            for (ZonedDateTime cursor = start.truncatedTo(ChronoUnit.HOURS);
                 cursor.isBefore(end);
                 cursor = cursor.plusHours(1)) {
                LocalDate date = cursor.toLocalDate();
                if (date.isBefore(from) || date.isAfter(to)) {
                    continue;
                }
                slots.put(new SlotKey(interval.getStaffId(), date, cursor.getHour()), Boolean.TRUE);
            }
        }

        return slots.keySet().stream()
                .map(key -> toFact(branchId, key))
                .toList();
    }

    private StaffHourFact toFact(long branchId, SlotKey key) {
        boolean benchmark = etlConfig.isBenchmarkHour(key.hour());
        return StaffHourFact.builder()
                .branchId(branchId)
                .staffId(key.staffId())
                .date(key.date())
                .hour(key.hour())
                .busy(true)
                .inBenchmark(benchmark)
                .inGray(!benchmark)
                .build();
    }
}
