package com.branchload.reporting.repository;

import com.branchload.reporting.entity.MonthlyPlan;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Monthly Plan Repository - plans_monthly, one target per (branch, metric, month)
 */
@Repository
@RequiredArgsConstructor
public class MonthlyPlanRepository {

    private static final String TABLE = "plans_monthly";
    private static final List<String> COLUMNS = List.of(
            "branch_code", "metric_code", "month_start", "metric_value", "updated_at");
    private static final List<String> KEYS = List.of("branch_code", "metric_code", "month_start");

    private final JdbcTemplate jdbcTemplate;
    private final StoreDialect dialect;
    private final Clock clock;

    public int upsertAll(List<MonthlyPlan> plans) {
        if (plans == null || plans.isEmpty()) return 0;
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Object[]> params = plans.stream()
                .filter(p -> p.getValue() != null)
                .map(p -> new Object[]{
                        p.getBranchCode(), p.getMetricCode(), p.getMonthStart().withDayOfMonth(1), p.getValue(), now
                })
                .toList();
        if (params.isEmpty()) return 0;
        jdbcTemplate.batchUpdate(dialect.upsertSql(TABLE, COLUMNS, KEYS), params);
        return params.size();
    }

    /**
     * @return metric code -> plan value for the month
     */
    public Map<String, Double> findByMonth(String branchCode, YearMonth month) {
        Map<String, Double> result = new HashMap<>();
        jdbcTemplate.query(
                "SELECT metric_code, metric_value FROM plans_monthly WHERE branch_code = ? AND month_start = ?",
                rs -> {
                    result.put(rs.getString("metric_code"), rs.getDouble("metric_value"));
                }, branchCode, month.atDay(1));
        return result;
    }

    /**
     * @return metric code -> (month -> plan value), every month on record
     */
    public Map<String, Map<YearMonth, Double>> findByCodes(String branchCode, Collection<String> metricCodes) {
        if (metricCodes == null || metricCodes.isEmpty()) return Map.of();

        String placeholders = String.join(",", Collections.nCopies(metricCodes.size(), "?"));
        List<Object> params = new ArrayList<>();
        params.add(branchCode);
        params.addAll(metricCodes);

        Map<String, Map<YearMonth, Double>> result = new HashMap<>();
        jdbcTemplate.query(
                "SELECT metric_code, month_start, metric_value FROM plans_monthly"
                        + " WHERE branch_code = ? AND metric_code IN (" + placeholders + ")",
                rs -> {
                    LocalDate monthStart = rs.getObject("month_start", LocalDate.class);
                    result.computeIfAbsent(rs.getString("metric_code"), k -> new TreeMap<>())
                            .put(YearMonth.from(monthStart), rs.getDouble("metric_value"));
                }, params.toArray());
        return result;
    }
}
