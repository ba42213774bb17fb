package com.branchload.reporting.repository;

import com.branchload.reporting.entity.StaffHourFact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Staff Hour Busy Repository - one row per (branch, staff, date, hour) the staff member was busy
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class StaffHourBusyRepository {

    private static final String TABLE = "staff_hour_busy";
    private static final List<String> COLUMNS = List.of(
            "branch_id", "staff_id", "work_date", "hour_of_day", "busy_flag", "in_benchmark", "in_gray");

    private final JdbcTemplate jdbcTemplate;
    private final StoreDialect dialect;

    public int deleteByBranchAndRange(long branchId, LocalDate from, LocalDate to) {
        int deleted = jdbcTemplate.update(
                "DELETE FROM staff_hour_busy WHERE branch_id = ? AND work_date >= ? AND work_date <= ?",
                branchId, from, to);
        log.debug("Deleted {} staff-hour rows for branch {} [{}..{}]", deleted, branchId, from, to);
        return deleted;
    }

    public int bulkInsert(List<StaffHourFact> facts) {
        if (facts == null || facts.isEmpty()) return 0;
        return dialect.bulkInsert(jdbcTemplate, TABLE, COLUMNS, facts.stream().map(this::mapToParams).toList());
    }

    public List<StaffHourFact> findByBranchAndRange(long branchId, LocalDate from, LocalDate to) {
        String sql = """
            SELECT * FROM staff_hour_busy
            WHERE branch_id = ? AND work_date >= ? AND work_date <= ?
            ORDER BY work_date, hour_of_day, staff_id
            """;
        return jdbcTemplate.query(sql, rowMapper(), branchId, from, to);
    }

    /**
     * Busy rows outside the benchmark window for the given staff members
     */
    public List<StaffHourFact> findGrayBusy(long branchId, Collection<Long> staffIds, LocalDate from, LocalDate to) {
        if (staffIds == null || staffIds.isEmpty()) return List.of();

        String placeholders = String.join(",", Collections.nCopies(staffIds.size(), "?"));
        String sql = "SELECT * FROM staff_hour_busy WHERE branch_id = ? AND work_date >= ? AND work_date <= ?"
                + " AND busy_flag = TRUE AND in_gray = TRUE AND staff_id IN (" + placeholders + ")"
                + " ORDER BY work_date, hour_of_day";

        List<Object> params = new ArrayList<>();
        params.add(branchId);
        params.add(from);
        params.add(to);
        params.addAll(staffIds);
        return jdbcTemplate.query(sql, rowMapper(), params.toArray());
    }

    public long countByBranch(long branchId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM staff_hour_busy WHERE branch_id = ?", Long.class, branchId);
        return count != null ? count : 0L;
    }

    private Object[] mapToParams(StaffHourFact f) {
        return new Object[]{
                f.getBranchId(), f.getStaffId(), f.getDate(), f.getHour(),
                f.getBusy(), f.getInBenchmark(), f.getInGray()
        };
    }

    private RowMapper<StaffHourFact> rowMapper() {
        return (rs, rowNum) -> StaffHourFact.builder()
                .branchId(rs.getLong("branch_id"))
                .staffId(rs.getLong("staff_id"))
                .date(rs.getObject("work_date", LocalDate.class))
                .hour(rs.getInt("hour_of_day"))
                .busy(rs.getBoolean("busy_flag"))
                .inBenchmark(rs.getBoolean("in_benchmark"))
                .inGray(rs.getBoolean("in_gray"))
                .build();
    }
}
