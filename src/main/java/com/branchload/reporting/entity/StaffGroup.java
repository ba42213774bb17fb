package com.branchload.reporting.entity;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Named set of staff sharing a resource type. Membership is frozen at construction.
 */
@Getter
@ToString
public class StaffGroup {

    private final String groupId;
    private final String name;
    private final Set<Long> staffIds;

    public StaffGroup(String groupId, String name, Set<Long> staffIds) {
        this.groupId = groupId;
        this.name = name;
        this.staffIds = Collections.unmodifiableSet(new LinkedHashSet<>(staffIds));
    }

    public int size() {
        return staffIds.size();
    }
}
