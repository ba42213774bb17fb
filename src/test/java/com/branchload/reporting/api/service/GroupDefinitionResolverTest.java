package com.branchload.reporting.api.service;

import com.branchload.reporting.api.client.SchedulingApiClient;
import com.branchload.reporting.cache.CaffeineTtlCache;
import com.branchload.reporting.config.EtlConfig;
import com.branchload.reporting.dto.group.BranchGroupConfig;
import com.branchload.reporting.dto.group.GroupConfig;
import com.branchload.reporting.dto.platform.StaffDto;
import com.branchload.reporting.dto.platform.StaffListResponse;
import com.branchload.reporting.entity.BranchGroups;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * GroupDefinitionResolver Test - name matching and the resolved document
 */
@Slf4j
class GroupDefinitionResolverTest {

    @TempDir
    Path tempDir;

    private SchedulingApiClient client;
    private EtlConfig config;
    private GroupDefinitionResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        Path source = tempDir.resolve("groups.json");
        Files.writeString(source, """
                {"branches": [{"branch_id": 7, "name": "Seven",
                  "groups": [{"group_id": "desks", "name": "Desks",
                              "staff_names": ["Desk 2", " Desk 1 ", "Desk 9", "Twin"]}]}]}
                """);

        config = new EtlConfig();
        config.setGroupConfigPath(source.toString());
        config.setGroupResolvedPath(tempDir.resolve("out/groups_resolved.json").toString());

        client = mock(SchedulingApiClient.class);
        resolver = new GroupDefinitionResolver(client, config, new ObjectMapper(),
                new CaffeineTtlCache<>("groups", Clock.systemUTC(), Duration.ofMinutes(5), 10));
    }

    @Test
    void shouldMatchTrimmedNamesAndSkipMissing() {
        BranchGroupConfig branch = BranchGroupConfig.builder()
                .branchId(7L)
                .name("Seven")
                .groups(List.of(GroupConfig.builder()
                        .groupId("desks")
                        .name("Desks")
                        .staffNames(List.of("Desk 2", " Desk 1 ", "Desk 9", "Twin"))
                        .build()))
                .build();

        BranchGroupConfig resolved = resolver.resolveBranch(branch, staffList());

        GroupConfig group = resolved.getGroups().get(0);
        assertThat(group.getStaffIds()).containsExactly(11L, 12L, 40L);
        assertThat(group.getStaffNames()).hasSize(4);
    }

    @Test
    void shouldWriteResolvedDocumentAndServeReads() {
        when(client.fetchStaff(7L)).thenReturn(StaffListResponse.builder()
                .success(true)
                .data(new ArrayList<>(staffList()))
                .build());

        Map<Long, BranchGroups> resolved = resolver.resolveAll(List.of(7L, 8L));

        assertThat(resolved.get(7L).getGroups()).hasSize(1);
        assertThat(resolved.get(7L).getGroups().get(0).getStaffIds()).containsExactly(11L, 12L, 40L);
        assertThat(resolved.get(8L).getGroups()).isEmpty();
        assertThat(Path.of(config.getGroupResolvedPath())).exists();
        verify(client, never()).fetchStaff(8L);

        GroupDefinitionResolver reader = new GroupDefinitionResolver(client, config, new ObjectMapper(),
                new CaffeineTtlCache<>("groups", Clock.systemUTC(), Duration.ofMinutes(5), 10));
        BranchGroups fromFile = reader.loadResolved(7L);
        assertThat(fromFile.getDisplayName()).isEqualTo("Seven");
        assertThat(fromFile.findGroup("desks")).get().extracting(g -> g.size()).isEqualTo(3);
        assertThat(reader.loadResolved(99L).getGroups()).isEmpty();
    }

    @Test
    void shouldReturnNoGroupsWithoutResolvedFile() {
        assertThat(resolver.loadResolved(7L).getGroups()).isEmpty();
    }

    private static List<StaffDto> staffList() {
        return List.of(
                StaffDto.builder().id(12L).name("Desk 2").build(),
                StaffDto.builder().id(11L).name("Desk 1").build(),
                StaffDto.builder().id(40L).name("Twin").build(),
                StaffDto.builder().id(41L).name("Twin ").build(),
                StaffDto.builder().id(null).name("Ghost").build());
    }
}
