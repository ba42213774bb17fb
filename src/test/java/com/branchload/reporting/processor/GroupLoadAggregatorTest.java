package com.branchload.reporting.processor;

import com.branchload.reporting.config.EtlConfig;
import com.branchload.reporting.entity.BranchGroups;
import com.branchload.reporting.entity.GroupHourLoad;
import com.branchload.reporting.entity.StaffGroup;
import com.branchload.reporting.entity.StaffHourFact;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * GroupLoadAggregator Test - dense grid, bounds, empty groups
 */
@Slf4j
class GroupLoadAggregatorTest {

    private static final LocalDate DAY = LocalDate.of(2025, 3, 5);

    private GroupLoadAggregator aggregator;
    private BranchGroups groups;

    @BeforeEach
    void setUp() {
        aggregator = new GroupLoadAggregator(new EtlConfig(), null, null);
        groups = new BranchGroups(1L, "Main", List.of(
                new StaffGroup("desks", "Desks", Set.of(11L, 12L, 13L)),
                new StaffGroup("empty", "Empty", Set.of())));
    }

    @Test
    void shouldProduceOneRowPerDateHourGroup() {
        List<GroupHourLoad> loads = aggregator.aggregate(groups, List.of(), DAY, DAY.plusDays(1));

        assertThat(loads).hasSize(2 * 24 * 2);
        assertThat(loads).allMatch(l -> l.getLoadPct() == 0.0 && l.getBusyCount() == 0);
    }

    @Test
    void shouldComputeRoundedLoadWithinBounds() {
        List<GroupHourLoad> loads = aggregator.aggregate(groups, List.of(
                fact(11L, 10), fact(12L, 10), fact(99L, 10), fact(11L, 22)), DAY, DAY);

        GroupHourLoad ten = cell(loads, "desks", 10);
        assertThat(ten.getBusyCount()).isEqualTo(2);
        assertThat(ten.getStaffTotal()).isEqualTo(3);
        assertThat(ten.getLoadPct()).isEqualTo(66.67);
        assertThat(ten.getInBenchmark()).isTrue();
        assertThat(ten.getDow()).isEqualTo(3);

        GroupHourLoad late = cell(loads, "desks", 22);
        assertThat(late.getLoadPct()).isEqualTo(33.33);
        assertThat(late.getInBenchmark()).isFalse();

        assertThat(loads).allSatisfy(l -> {
            assertThat(l.getBusyCount()).isBetween(0, l.getStaffTotal());
            assertThat(l.getLoadPct()).isBetween(0.0, 100.0);
        });
    }

    @Test
    void shouldReportZeroForEmptyGroup() {
        List<GroupHourLoad> loads = aggregator.aggregate(groups, List.of(fact(11L, 10)), DAY, DAY);

        GroupHourLoad empty = cell(loads, "empty", 10);
        assertThat(empty.getStaffTotal()).isZero();
        assertThat(empty.getLoadPct()).isEqualTo(0.0);
        assertThat(GroupLoadAggregator.loadPct(0, 0)).isEqualTo(0.0);
        assertThat(GroupLoadAggregator.loadPct(3, 3)).isEqualTo(100.0);
    }

    private static StaffHourFact fact(long staffId, int hour) {
        return StaffHourFact.builder().branchId(1L).staffId(staffId).date(DAY).hour(hour).build();
    }

    private static GroupHourLoad cell(List<GroupHourLoad> loads, String groupId, int hour) {
        return loads.stream()
                .filter(l -> l.getGroupId().equals(groupId) && l.getHour() == hour)
                .findFirst()
                .orElseThrow();
    }
}
