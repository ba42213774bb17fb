package com.branchload.reporting.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * Embedded single-file store (H2): MERGE ... KEY upserts, JDBC batch inserts
 */
@Component
@ConditionalOnProperty(prefix = "reporting", name = "store", havingValue = "h2", matchIfMissing = true)
@Slf4j
public class H2StoreDialect implements StoreDialect {

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public String upsertSql(String table, List<String> columns, List<String> keyColumns) {
        String placeholders = String.join(", ", Collections.nCopies(columns.size(), "?"));
        return "MERGE INTO " + table + " (" + String.join(", ", columns) + ")"
                + " KEY (" + String.join(", ", keyColumns) + ")"
                + " VALUES (" + placeholders + ")";
    }

    @Override
    public int bulkInsert(JdbcTemplate jdbcTemplate, String table, List<String> columns, List<Object[]> rows) {
        log.debug("Batch inserting {} rows into {}", rows.size(), table);
        return batchInsert(jdbcTemplate, table, columns, rows);
    }
}
