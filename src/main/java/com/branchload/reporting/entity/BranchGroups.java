package com.branchload.reporting.entity;

import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of a branch's resolved staff groups, taken once per run.
 */
@Getter
@ToString
public class BranchGroups {

    private final long branchId;
    private final String displayName;
    private final List<StaffGroup> groups;

    public BranchGroups(long branchId, String displayName, List<StaffGroup> groups) {
        this.branchId = branchId;
        this.displayName = displayName;
        this.groups = List.copyOf(groups);
    }

    public Optional<StaffGroup> findGroup(String groupId) {
        return groups.stream().filter(g -> g.getGroupId().equals(groupId)).findFirst();
    }
}
