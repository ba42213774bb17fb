package com.branchload.reporting.config;

import com.branchload.reporting.cache.CaffeineTtlCache;
import com.branchload.reporting.cache.TtlCache;
import com.branchload.reporting.entity.Branch;
import com.branchload.reporting.entity.BranchGroups;
import com.branchload.reporting.entity.MetricDefinition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Lookup caches for the read paths, one bean per lookup
 */
@Configuration
public class CacheConfig {

    private static final long MAXIMUM_SIZE = 1_000;

    @Bean
    public TtlCache<Long, BranchGroups> branchGroupsCache(Clock clock, ReportingConfig reportingConfig) {
        return new CaffeineTtlCache<>("branch-groups", clock, reportingConfig.getCacheTtl(), MAXIMUM_SIZE);
    }

    @Bean
    public TtlCache<String, List<Branch>> branchDirectoryCache(Clock clock, ReportingConfig reportingConfig) {
        return new CaffeineTtlCache<>("branch-directory", clock, reportingConfig.getCacheTtl(), MAXIMUM_SIZE);
    }

    @Bean
    public TtlCache<String, List<MetricDefinition>> metricCatalogCache(Clock clock, ReportingConfig reportingConfig) {
        return new CaffeineTtlCache<>("metric-catalog", clock, reportingConfig.getCacheTtl(), MAXIMUM_SIZE);
    }
}
