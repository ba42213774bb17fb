package com.branchload.reporting.processor;

import com.branchload.reporting.config.EtlConfig;
import com.branchload.reporting.entity.StaffHourFact;
import com.branchload.reporting.entity.VisitInterval;
import com.branchload.reporting.entity.enums.AttendanceClass;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * HourlyOccupancyBuilder Test - interval to hour-bucket expansion
 */
@Slf4j
class HourlyOccupancyBuilderTest {

    private static final long BRANCH_ID = 1L;
    private static final ZoneId ZONE = ZoneId.of("Europe/Moscow");
    private static final LocalDate DAY = LocalDate.of(2025, 3, 5);

    private HourlyOccupancyBuilder builder;

    @BeforeEach
    void setUp() {
        EtlConfig config = new EtlConfig();
        config.setTimezone(ZONE.getId());
        builder = new HourlyOccupancyBuilder(config, null);
    }

    @Test
    void shouldMarkEveryTouchedHourBusy() {
        List<StaffHourFact> facts = builder.buildFacts(BRANCH_ID,
                List.of(visit(1L, 11L, "2025-03-05T10:30", "2025-03-05T12:00")), DAY, DAY);

        assertThat(facts).extracting(StaffHourFact::getHour).containsExactly(10, 11);
        assertThat(facts).allMatch(f -> f.getBusy() && f.getInBenchmark() && !f.getInGray());
    }

    @Test
    void shouldCollapseOverlappingVisitsOfOneStaff() {
        List<StaffHourFact> facts = builder.buildFacts(BRANCH_ID, List.of(
                visit(1L, 11L, "2025-03-05T10:00", "2025-03-05T11:30"),
                visit(2L, 11L, "2025-03-05T11:15", "2025-03-05T12:10"),
                visit(3L, 12L, "2025-03-05T11:00", "2025-03-05T11:45")), DAY, DAY);

        assertThat(facts).hasSize(4);
        assertThat(facts.stream().filter(f -> f.getStaffId() == 11L).map(StaffHourFact::getHour))
                .containsExactly(10, 11, 12);
    }

    @Test
    void shouldFlagGrayHoursAndClipToWindow() {
        List<StaffHourFact> facts = builder.buildFacts(BRANCH_ID, List.of(
                visit(1L, 11L, "2025-03-05T22:30", "2025-03-06T00:30"),
                visit(2L, 11L, "2025-03-05T08:00", "2025-03-05T09:00")), DAY, DAY);

        assertThat(facts).extracting(StaffHourFact::getHour).containsExactly(8, 22, 23);
        assertThat(facts).allMatch(f -> f.getInGray() && !f.getInBenchmark());
        assertThat(facts).allMatch(f -> f.getDate().equals(DAY));
    }

    @Test
    void shouldIgnoreNonFactAndEmptyIntervals() {
        VisitInterval missed = visit(1L, 11L, "2025-03-05T10:00", "2025-03-05T11:00");
        missed.setAttendanceClass(AttendanceClass.NON_FACT);
        VisitInterval zeroLength = visit(2L, 11L, "2025-03-05T14:00", "2025-03-05T14:00");

        assertThat(builder.buildFacts(BRANCH_ID, List.of(missed, zeroLength), DAY, DAY)).isEmpty();
        assertThat(builder.buildFacts(BRANCH_ID, List.of(), DAY, DAY)).isEmpty();
    }

    @Test
    void shouldRejectReversedWindow() {
        assertThatThrownBy(() -> builder.buildFacts(BRANCH_ID, List.of(), DAY, DAY.minusDays(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static VisitInterval visit(long recordId, long staffId, String start, String end) {
        return VisitInterval.builder()
                .branchId(BRANCH_ID)
                .staffId(staffId)
                .recordId(recordId)
                .start(LocalDateTime.parse(start).atZone(ZONE))
                .end(LocalDateTime.parse(end).atZone(ZONE))
                .attendanceCode(1)
                .build();
    }
}
