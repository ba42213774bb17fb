package com.branchload.reporting.repository;

import com.branchload.reporting.entity.Branch;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Branch Repository - branch directory for the financial engine
 */
@Repository
@RequiredArgsConstructor
public class BranchRepository {

    private static final List<String> COLUMNS = List.of("code", "name");
    private static final List<String> KEYS = List.of("code");

    private final JdbcTemplate jdbcTemplate;
    private final StoreDialect dialect;

    public int upsertAll(List<Branch> branches) {
        if (branches == null || branches.isEmpty()) return 0;
        jdbcTemplate.batchUpdate(dialect.upsertSql("branches", COLUMNS, KEYS),
                branches.stream().map(b -> new Object[]{b.getCode(), b.getName()}).toList());
        return branches.size();
    }

    public List<Branch> findAll() {
        return jdbcTemplate.query("SELECT * FROM branches ORDER BY code", rowMapper());
    }

    private RowMapper<Branch> rowMapper() {
        return (rs, rowNum) -> Branch.builder()
                .code(rs.getString("code"))
                .name(rs.getString("name"))
                .build();
    }
}
