package com.branchload.reporting.repository;

import com.branchload.reporting.entity.MetricDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Metric Repository - metric catalog (labels, units, plan flags)
 */
@Repository
@RequiredArgsConstructor
public class MetricRepository {

    private static final List<String> COLUMNS = List.of(
            "code", "label", "unit", "group_name", "is_derived", "plan_enabled", "sort_order");
    private static final List<String> KEYS = List.of("code");

    private final JdbcTemplate jdbcTemplate;
    private final StoreDialect dialect;

    /**
     * List position becomes the display order.
     */
    public int upsertAll(List<MetricDefinition> metrics) {
        if (metrics == null || metrics.isEmpty()) return 0;
        List<Object[]> rows = new ArrayList<>(metrics.size());
        for (int i = 0; i < metrics.size(); i++) {
            MetricDefinition m = metrics.get(i);
            rows.add(new Object[]{
                    m.getCode(), m.getLabel(), m.getUnit(), m.getGroupName(),
                    Boolean.TRUE.equals(m.getDerived()), Boolean.TRUE.equals(m.getPlanEnabled()), i
            });
        }
        jdbcTemplate.batchUpdate(dialect.upsertSql("metrics", COLUMNS, KEYS), rows);
        return metrics.size();
    }

    public List<MetricDefinition> findAll() {
        return jdbcTemplate.query("SELECT * FROM metrics ORDER BY sort_order, code", rowMapper());
    }

    private RowMapper<MetricDefinition> rowMapper() {
        return (rs, rowNum) -> MetricDefinition.builder()
                .code(rs.getString("code"))
                .label(rs.getString("label"))
                .unit(rs.getString("unit"))
                .groupName(rs.getString("group_name"))
                .derived(rs.getBoolean("is_derived"))
                .planEnabled(rs.getBoolean("plan_enabled"))
                .build();
    }
}
