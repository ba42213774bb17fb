package com.branchload.reporting.repository;

import com.branchload.reporting.entity.DailyMetricFact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Daily Metric Repository - manual_sheet_daily, one value per (branch, metric, date)
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class DailyMetricRepository {

    private static final String TABLE = "manual_sheet_daily";
    private static final List<String> COLUMNS = List.of(
            "branch_code", "metric_code", "fact_date", "metric_value", "source", "updated_at");
    private static final List<String> KEYS = List.of("branch_code", "metric_code", "fact_date");

    private final JdbcTemplate jdbcTemplate;
    private final StoreDialect dialect;
    private final Clock clock;

    /**
     * Facts without a value are skipped; a missing fact means "no data", never zero.
     */
    public int upsertAll(List<DailyMetricFact> facts) {
        if (facts == null || facts.isEmpty()) return 0;
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Object[]> params = facts.stream()
                .filter(f -> f.getValue() != null)
                .map(f -> new Object[]{
                        f.getBranchCode(), f.getMetricCode(), f.getDate(), f.getValue(), f.getSource(), now
                })
                .toList();
        if (params.isEmpty()) return 0;
        jdbcTemplate.batchUpdate(dialect.upsertSql(TABLE, COLUMNS, KEYS), params);
        log.debug("Upserted {} daily facts", params.size());
        return params.size();
    }

    /**
     * @return metric code -> (date -> value), dates ascending; codes without rows are absent
     */
    public Map<String, Map<LocalDate, Double>> findValues(String branchCode, Collection<String> metricCodes,
                                                           LocalDate from, LocalDate to) {
        if (metricCodes == null || metricCodes.isEmpty()) return Map.of();

        String placeholders = String.join(",", Collections.nCopies(metricCodes.size(), "?"));
        String sql = "SELECT metric_code, fact_date, metric_value FROM manual_sheet_daily"
                + " WHERE branch_code = ? AND fact_date >= ? AND fact_date <= ?"
                + " AND metric_code IN (" + placeholders + ")";

        List<Object> params = new ArrayList<>();
        params.add(branchCode);
        params.add(from);
        params.add(to);
        params.addAll(metricCodes);

        Map<String, Map<LocalDate, Double>> result = new HashMap<>();
        jdbcTemplate.query(sql, rs -> {
            result.computeIfAbsent(rs.getString("metric_code"), k -> new TreeMap<>())
                    .put(rs.getObject("fact_date", LocalDate.class), rs.getDouble("metric_value"));
        }, params.toArray());
        return result;
    }

    /**
     * Latest date in the range carrying any metric other than the excluded ones.
     */
    public LocalDate findLastFactDate(String branchCode, LocalDate from, LocalDate to, Collection<String> excludedCodes) {
        StringBuilder sql = new StringBuilder(
                "SELECT MAX(fact_date) FROM manual_sheet_daily WHERE branch_code = ? AND fact_date >= ? AND fact_date <= ?");
        List<Object> params = new ArrayList<>(List.of(branchCode, from, to));
        if (excludedCodes != null && !excludedCodes.isEmpty()) {
            sql.append(" AND metric_code NOT IN (")
                    .append(String.join(",", Collections.nCopies(excludedCodes.size(), "?")))
                    .append(")");
            params.addAll(excludedCodes);
        }
        return jdbcTemplate.queryForObject(sql.toString(),
                (rs, rowNum) -> rs.getObject(1, LocalDate.class), params.toArray());
    }

    /**
     * Months with at least one fact, newest first.
     */
    public List<YearMonth> findMonths(String branchCode) {
        String sql = """
            SELECT DISTINCT EXTRACT(YEAR FROM fact_date) AS fact_year, EXTRACT(MONTH FROM fact_date) AS fact_month
            FROM manual_sheet_daily WHERE branch_code = ?
            """;
        List<YearMonth> months = new ArrayList<>(jdbcTemplate.query(sql,
                (rs, rowNum) -> YearMonth.of(rs.getInt("fact_year"), rs.getInt("fact_month")), branchCode));
        months.sort(Comparator.reverseOrder());
        return months;
    }

    /**
     * @return metric code -> (month -> sum of daily values)
     */
    public Map<String, Map<YearMonth, Double>> findMonthlyTotals(String branchCode, Collection<String> metricCodes) {
        if (metricCodes == null || metricCodes.isEmpty()) return Map.of();

        String placeholders = String.join(",", Collections.nCopies(metricCodes.size(), "?"));
        String sql = "SELECT metric_code, EXTRACT(YEAR FROM fact_date) AS fact_year,"
                + " EXTRACT(MONTH FROM fact_date) AS fact_month, SUM(metric_value) AS total"
                + " FROM manual_sheet_daily WHERE branch_code = ? AND metric_code IN (" + placeholders + ")"
                + " GROUP BY metric_code, EXTRACT(YEAR FROM fact_date), EXTRACT(MONTH FROM fact_date)";

        List<Object> params = new ArrayList<>();
        params.add(branchCode);
        params.addAll(metricCodes);

        Map<String, Map<YearMonth, Double>> result = new HashMap<>();
        jdbcTemplate.query(sql, rs -> {
            result.computeIfAbsent(rs.getString("metric_code"), k -> new TreeMap<>())
                    .put(YearMonth.of(rs.getInt("fact_year"), rs.getInt("fact_month")), rs.getDouble("total"));
        }, params.toArray());
        return result;
    }

    public List<String> findBranchCodes() {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT branch_code FROM manual_sheet_daily ORDER BY branch_code", String.class);
    }

    public int deleteByBranchAndRange(String branchCode, LocalDate from, LocalDate to) {
        return jdbcTemplate.update(
                "DELETE FROM manual_sheet_daily WHERE branch_code = ? AND fact_date >= ? AND fact_date <= ?",
                branchCode, from, to);
    }
}
