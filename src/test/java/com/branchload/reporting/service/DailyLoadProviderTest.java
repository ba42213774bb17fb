package com.branchload.reporting.service;

import com.branchload.reporting.config.ReportingConfig;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class DailyLoadProviderTest {

    @Test
    void shouldNormalizeGroupNames() {
        assertThat(DailyLoadProvider.normalizeName("  Рабочие   Места ")).isEqualTo("рабочие места");
        assertThat(DailyLoadProvider.normalizeName("Ёлка")).isEqualTo("елка");
        assertThat(DailyLoadProvider.normalizeName(null)).isEmpty();
    }

    @Test
    void shouldReturnNothingForBranchWithoutLoadGroup() {
        DailyLoadProvider provider = new DailyLoadProvider(
                new ReportingConfig(), null, null);

        assertThat(provider.dailyLoad("NOWHERE", LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 31))).isEmpty();
    }
}
