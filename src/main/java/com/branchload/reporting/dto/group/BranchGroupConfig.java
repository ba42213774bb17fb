package com.branchload.reporting.dto.group;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BranchGroupConfig {

    @JsonProperty("branch_id")
    private Long branchId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("groups")
    @Builder.Default
    private List<GroupConfig> groups = new ArrayList<>();
}
