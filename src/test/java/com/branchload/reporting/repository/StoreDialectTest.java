package com.branchload.reporting.repository;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * StoreDialect Test - generated SQL of both backends
 */
class StoreDialectTest {

    private static final List<String> COLUMNS = List.of("branch_code", "metric_code", "fact_date", "metric_value");
    private static final List<String> KEYS = List.of("branch_code", "metric_code", "fact_date");

    @Test
    void shouldMergeByKeyOnH2() {
        assertThat(new H2StoreDialect().upsertSql("manual_sheet_daily", COLUMNS, KEYS)).isEqualTo(
                "MERGE INTO manual_sheet_daily (branch_code, metric_code, fact_date, metric_value)"
                        + " KEY (branch_code, metric_code, fact_date) VALUES (?, ?, ?, ?)");
    }

    @Test
    void shouldUpsertOnConflictOnPostgres() {
        PostgresStoreDialect dialect = new PostgresStoreDialect();

        assertThat(dialect.upsertSql("manual_sheet_daily", COLUMNS, KEYS)).isEqualTo(
                "INSERT INTO manual_sheet_daily (branch_code, metric_code, fact_date, metric_value) VALUES (?, ?, ?, ?)"
                        + " ON CONFLICT (branch_code, metric_code, fact_date) DO UPDATE SET metric_value = EXCLUDED.metric_value");
        assertThat(dialect.upsertSql("branches", List.of("code"), List.of("code")))
                .endsWith("ON CONFLICT (code) DO NOTHING");
    }

    @Test
    void shouldBuildPlainInsert() {
        assertThat(new H2StoreDialect().insertSql("group_hour_load", List.of("branch_id", "group_id")))
                .isEqualTo("INSERT INTO group_hour_load (branch_id, group_id) VALUES (?, ?)");
    }
}
