package com.branchload.reporting.mapper;

import com.branchload.reporting.config.EtlConfig;
import com.branchload.reporting.dto.platform.RawBookingDto;
import com.branchload.reporting.entity.VisitInterval;
import com.branchload.reporting.entity.enums.AttendanceClass;
import com.branchload.reporting.util.TimestampParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Visit Record Normalizer - turns raw platform bookings into canonical visit intervals
 *
 * RULES:
 * - attendance read from "attendance", falling back to "visit_attendance"; only codes 1 and 2 are kept
 * - start read from "datetime", falling back to "date"; parsed in the configured timezone
 * - end = start + duration seconds ("seance_length", then "length"; 0 when unreadable)
 * - records without staff id, record id or start are skipped, never fatal
 * - output is unique per (branch_id, record_id), last write wins
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VisitRecordNormalizer {

    private final EtlConfig etlConfig;
    private final Clock clock;

    public List<VisitInterval> normalize(long branchId, List<RawBookingDto> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }

        ZoneId zone = etlConfig.getZoneId();
        Map<Long, VisitInterval> byRecordId = new LinkedHashMap<>();
        int dropped = 0;

        for (RawBookingDto record : records) {
            VisitInterval interval = toInterval(branchId, record, zone);
            if (interval == null) {
                dropped++;
                continue;
            }
            byRecordId.put(interval.getRecordId(), interval);
        }

        log.info("Branch {}: normalized {} visits from {} records ({} dropped)",
                branchId, byRecordId.size(), records.size(), dropped);
        return new ArrayList<>(byRecordId.values());
    }

    VisitInterval toInterval(long branchId, RawBookingDto record, ZoneId zone) {
        if (record == null) {
            return null;
        }

        String attendanceRaw = record.getAttendance() != null ? record.getAttendance() : record.getVisitAttendance();
        Integer attendance = parseInteger(attendanceRaw);
        if (attendance == null || AttendanceClass.fromCode(attendance) != AttendanceClass.FACT) {
            log.debug("Skipping record {}: attendance {}", record.getId(), attendanceRaw);
            return null;
        }

        Long staffId = parseLong(record.getStaffId());
        Long recordId = parseLong(record.getId());
        if (staffId == null || recordId == null) {
            log.debug("Skipping record {}: missing staff or record id", record.getId());
            return null;
        }

        String startRaw = firstNonBlank(record.getDatetime(), record.getDate());
        if (startRaw == null) {
            log.debug("Skipping record {}: missing start", recordId);
            return null;
        }

        ZonedDateTime start;
        try {
            start = TimestampParser.parse(startRaw, zone);
        } catch (DateTimeException e) {
            log.debug("Skipping record {}: unreadable start '{}'", recordId, startRaw);
            return null;
        }

        long durationSeconds = parseDuration(record);
        String updatedAt = firstNonBlank(record.getLastChangeDate(), record.getCreateDate());

        return VisitInterval.builder()
                .branchId(branchId)
                .staffId(staffId)
                .recordId(recordId)
                .start(start)
                .end(start.plusSeconds(durationSeconds))
                .attendanceCode(attendance)
                .attendanceClass(AttendanceClass.FACT)
                .updatedAt(updatedAt != null ? updatedAt : Instant.now(clock).toString())
                .build();
    }

    private long parseDuration(RawBookingDto record) {
        String raw = firstNonZero(record.getSeanceLength(), record.getLength());
        if (raw == null) {
            return 0L;
        }
        Long parsed = parseLong(raw);
        return parsed != null ? parsed : 0L;
    }

    private static String firstNonBlank(String primary, String fallback) {
        if (primary != null && !primary.isBlank()) return primary;
        if (fallback != null && !fallback.isBlank()) return fallback;
        return null;
    }

    private static String firstNonZero(String primary, String fallback) {
        if (primary != null && !primary.isBlank() && !"0".equals(primary.trim())) return primary;
        if (fallback != null && !fallback.isBlank()) return fallback;
        return null;
    }

    private static Integer parseInteger(String value) {
        Long parsed = parseLong(value);
        if (parsed == null || parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE) {
            return null;
        }
        return parsed.intValue();
    }

    private static Long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
