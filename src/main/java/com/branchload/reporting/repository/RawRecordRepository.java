package com.branchload.reporting.repository;

import com.branchload.reporting.entity.VisitInterval;
import com.branchload.reporting.entity.enums.AttendanceClass;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Raw Record Repository - normalized visits keyed by (branch_id, record_id)
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class RawRecordRepository {

    private static final String TABLE = "raw_records";
    private static final List<String> COLUMNS = List.of(
            "branch_id", "record_id", "staff_id", "start_at", "end_at", "attendance", "is_fact", "updated_at");
    private static final List<String> KEYS = List.of("branch_id", "record_id");

    private final JdbcTemplate jdbcTemplate;
    private final StoreDialect dialect;

    /**
     * Insert new records, overwrite known ones (same branch and record id)
     */
    public int bulkUpsert(List<VisitInterval> visits) {
        if (visits == null || visits.isEmpty()) return 0;
        log.debug("Upserting {} raw records", visits.size());
        jdbcTemplate.batchUpdate(dialect.upsertSql(TABLE, COLUMNS, KEYS),
                visits.stream().map(this::mapToParams).toList());
        return visits.size();
    }

    public List<VisitInterval> findByBranchAndRange(long branchId, ZonedDateTime from, ZonedDateTime to) {
        String sql = "SELECT * FROM raw_records WHERE branch_id = ? AND start_at < ? AND end_at > ? ORDER BY start_at, record_id";
        ZoneId zone = from.getZone();
        return jdbcTemplate.query(sql, rowMapper(zone), branchId, to.toOffsetDateTime(), from.toOffsetDateTime());
    }

    public long countByBranch(long branchId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM raw_records WHERE branch_id = ?", Long.class, branchId);
        return count != null ? count : 0L;
    }

    private Object[] mapToParams(VisitInterval v) {
        return new Object[]{
                v.getBranchId(), v.getRecordId(), v.getStaffId(),
                v.getStart().toOffsetDateTime(), v.getEnd().toOffsetDateTime(),
                v.getAttendanceCode(), v.getAttendanceClass() == AttendanceClass.FACT,
                v.getUpdatedAt()
        };
    }

    private RowMapper<VisitInterval> rowMapper(ZoneId zone) {
        return (rs, rowNum) -> VisitInterval.builder()
                .branchId(rs.getLong("branch_id"))
                .recordId(rs.getLong("record_id"))
                .staffId(rs.getLong("staff_id"))
                .start(rs.getObject("start_at", OffsetDateTime.class).atZoneSameInstant(zone))
                .end(rs.getObject("end_at", OffsetDateTime.class).atZoneSameInstant(zone))
                .attendanceCode(rs.getInt("attendance"))
                .attendanceClass(rs.getBoolean("is_fact") ? AttendanceClass.FACT : AttendanceClass.NON_FACT)
                .updatedAt(rs.getString("updated_at"))
                .build();
    }
}
