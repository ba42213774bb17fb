package com.branchload.reporting.api.service;

import com.branchload.reporting.api.client.SchedulingApiClient;
import com.branchload.reporting.cache.TtlCache;
import com.branchload.reporting.config.EtlConfig;
import com.branchload.reporting.dto.group.BranchGroupConfig;
import com.branchload.reporting.dto.group.GroupConfig;
import com.branchload.reporting.dto.group.GroupConfigDocument;
import com.branchload.reporting.dto.platform.StaffDto;
import com.branchload.reporting.dto.platform.StaffListResponse;
import com.branchload.reporting.entity.BranchGroups;
import com.branchload.reporting.entity.StaffGroup;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Group Definition Resolver - maps configured staff names to platform staff ids
 *
 * - names are matched after trimming; the first platform match wins
 * - missing or ambiguous names are logged and skipped / resolved to the first match
 * - the resolved document (sorted, distinct staff_ids) is written next to the source
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupDefinitionResolver {

    private final SchedulingApiClient schedulingApiClient;
    private final EtlConfig etlConfig;
    private final ObjectMapper objectMapper;
    private final TtlCache<Long, BranchGroups> branchGroupsCache;

    /**
     * Resolve groups of the given branches against the live staff lists and persist the result.
     */
    public Map<Long, BranchGroups> resolveAll(List<Long> branchIds) {
        GroupConfigDocument source = readDocument(Path.of(etlConfig.getGroupConfigPath()));
        Map<Long, BranchGroups> resolved = new LinkedHashMap<>();
        List<BranchGroupConfig> resolvedConfigs = new ArrayList<>();

        for (Long branchId : branchIds) {
            Optional<BranchGroupConfig> config = findBranch(source, branchId);
            if (config.isEmpty()) {
                log.warn("⚠️ No group definitions for branch {}", branchId);
                resolved.put(branchId, new BranchGroups(branchId, String.valueOf(branchId), List.of()));
                continue;
            }

            StaffListResponse staff = schedulingApiClient.fetchStaff(branchId);
            BranchGroupConfig resolvedConfig = resolveBranch(config.get(), staff.getData());
            resolvedConfigs.add(resolvedConfig);

            BranchGroups groups = toBranchGroups(resolvedConfig);
            resolved.put(branchId, groups);
            branchGroupsCache.put(branchId, groups);
        }

        writeDocument(Path.of(etlConfig.getGroupResolvedPath()),
                GroupConfigDocument.builder().branches(resolvedConfigs).build());
        return resolved;
    }

    /**
     * Groups from the last resolved document, for read paths. Unknown branch yields no groups.
     */
    public BranchGroups loadResolved(long branchId) {
        return branchGroupsCache.getOrLoad(branchId, () -> {
            Path path = Path.of(etlConfig.getGroupResolvedPath());
            if (!Files.exists(path)) {
                log.warn("Resolved group file {} not found", path);
                return new BranchGroups(branchId, String.valueOf(branchId), List.of());
            }
            return findBranch(readDocument(path), branchId)
                    .map(this::toBranchGroups)
                    .orElseGet(() -> new BranchGroups(branchId, String.valueOf(branchId), List.of()));
        });
    }

    BranchGroupConfig resolveBranch(BranchGroupConfig config, List<StaffDto> staffList) {
        Map<String, List<Long>> idsByName = new LinkedHashMap<>();
        for (StaffDto staff : staffList) {
            if (staff.getId() == null || staff.getName() == null) continue;
            idsByName.computeIfAbsent(staff.getName().trim(), k -> new ArrayList<>()).add(staff.getId());
        }

        List<GroupConfig> groups = new ArrayList<>();
        for (GroupConfig group : config.getGroups()) {
            Set<Long> ids = new TreeSet<>();
            for (String rawName : group.getStaffNames()) {
                String name = rawName == null ? "" : rawName.trim();
                List<Long> matches = idsByName.getOrDefault(name, List.of());
                if (matches.isEmpty()) {
                    log.warn("⚠️ Branch {} group {}: staff '{}' not found", config.getBranchId(), group.getGroupId(), name);
                    continue;
                }
                if (matches.size() > 1) {
                    log.warn("⚠️ Branch {} group {}: staff '{}' is ambiguous {}, using {}",
                            config.getBranchId(), group.getGroupId(), name, matches, matches.get(0));
                }
                ids.add(matches.get(0));
            }
            groups.add(GroupConfig.builder()
                    .groupId(group.getGroupId())
                    .name(group.getName())
                    .staffNames(group.getStaffNames())
                    .staffIds(new ArrayList<>(ids))
                    .build());
        }

        return BranchGroupConfig.builder()
                .branchId(config.getBranchId())
                .name(config.getName())
                .groups(groups)
                .build();
    }

    private BranchGroups toBranchGroups(BranchGroupConfig config) {
        List<StaffGroup> groups = config.getGroups().stream()
                .map(g -> new StaffGroup(g.getGroupId(), g.getName(), new LinkedHashSet<>(g.getStaffIds())))
                .toList();
        String displayName = config.getName() != null ? config.getName() : String.valueOf(config.getBranchId());
        return new BranchGroups(config.getBranchId(), displayName, groups);
    }

    private static Optional<BranchGroupConfig> findBranch(GroupConfigDocument document, long branchId) {
        return document.getBranches().stream()
                .filter(b -> b.getBranchId() != null && b.getBranchId() == branchId)
                .findFirst();
    }

    private GroupConfigDocument readDocument(Path path) {
        try {
            return objectMapper.readValue(path.toFile(), GroupConfigDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read group definitions from " + path, e);
        }
    }

    private void writeDocument(Path path, GroupConfigDocument document) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), document);
            log.info("💾 Resolved groups written to {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write resolved groups to " + path, e);
        }
    }
}
