package com.branchload.reporting.repository;

import com.branchload.reporting.entity.GroupHourLoad;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Group Hour Load Repository - per-group hourly occupancy aggregate
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class GroupHourLoadRepository {

    private static final String TABLE = "group_hour_load";
    private static final List<String> COLUMNS = List.of(
            "branch_id", "group_id", "work_date", "dow", "hour_of_day",
            "busy_count", "staff_total", "load_pct", "in_benchmark");

    private final JdbcTemplate jdbcTemplate;
    private final StoreDialect dialect;

    public int deleteByBranchAndRange(long branchId, LocalDate from, LocalDate to) {
        int deleted = jdbcTemplate.update(
                "DELETE FROM group_hour_load WHERE branch_id = ? AND work_date >= ? AND work_date <= ?",
                branchId, from, to);
        log.debug("Deleted {} group-hour rows for branch {} [{}..{}]", deleted, branchId, from, to);
        return deleted;
    }

    public int bulkInsert(List<GroupHourLoad> loads) {
        if (loads == null || loads.isEmpty()) return 0;
        return dialect.bulkInsert(jdbcTemplate, TABLE, COLUMNS, loads.stream().map(this::mapToParams).toList());
    }

    public List<GroupHourLoad> findByGroupAndRange(long branchId, String groupId, LocalDate from, LocalDate to) {
        String sql = """
            SELECT * FROM group_hour_load
            WHERE branch_id = ? AND group_id = ? AND work_date >= ? AND work_date <= ?
            ORDER BY work_date, hour_of_day
            """;
        return jdbcTemplate.query(sql, rowMapper(), branchId, groupId, from, to);
    }

    public List<GroupHourLoad> findBenchmarkByGroupAndRange(long branchId, String groupId, LocalDate from, LocalDate to) {
        String sql = """
            SELECT * FROM group_hour_load
            WHERE branch_id = ? AND group_id = ? AND work_date >= ? AND work_date <= ? AND in_benchmark = TRUE
            ORDER BY work_date, hour_of_day
            """;
        return jdbcTemplate.query(sql, rowMapper(), branchId, groupId, from, to);
    }

    public long countByBranch(long branchId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM group_hour_load WHERE branch_id = ?", Long.class, branchId);
        return count != null ? count : 0L;
    }

    private Object[] mapToParams(GroupHourLoad g) {
        return new Object[]{
                g.getBranchId(), g.getGroupId(), g.getDate(), g.getDow(), g.getHour(),
                g.getBusyCount(), g.getStaffTotal(), g.getLoadPct(), g.getInBenchmark()
        };
    }

    private RowMapper<GroupHourLoad> rowMapper() {
        return (rs, rowNum) -> GroupHourLoad.builder()
                .branchId(rs.getLong("branch_id"))
                .groupId(rs.getString("group_id"))
                .date(rs.getObject("work_date", LocalDate.class))
                .dow(rs.getInt("dow"))
                .hour(rs.getInt("hour_of_day"))
                .busyCount(rs.getInt("busy_count"))
                .staffTotal(rs.getInt("staff_total"))
                .loadPct(rs.getDouble("load_pct"))
                .inBenchmark(rs.getBoolean("in_benchmark"))
                .build();
    }
}
