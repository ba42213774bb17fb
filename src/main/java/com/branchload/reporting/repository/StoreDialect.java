package com.branchload.reporting.repository;

import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Collections;
import java.util.List;

/**
 * Backend-specific SQL for the statements that differ between the embedded and the
 * networked store. One implementation per backend; repositories never branch on it.
 */
public interface StoreDialect {

    String name();

    /**
     * Insert-or-update statement keyed by {@code keyColumns}, one placeholder per column.
     */
    String upsertSql(String table, List<String> columns, List<String> keyColumns);

    /**
     * Plain bulk insert of fresh rows into a table whose key range was just cleared.
     *
     * @return number of rows written
     */
    int bulkInsert(JdbcTemplate jdbcTemplate, String table, List<String> columns, List<Object[]> rows);

    default String insertSql(String table, List<String> columns) {
        String placeholders = String.join(", ", Collections.nCopies(columns.size(), "?"));
        return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")";
    }

    default int batchInsert(JdbcTemplate jdbcTemplate, String table, List<String> columns, List<Object[]> rows) {
        if (rows.isEmpty()) return 0;
        jdbcTemplate.batchUpdate(insertSql(table, columns), rows);
        return rows.size();
    }
}
