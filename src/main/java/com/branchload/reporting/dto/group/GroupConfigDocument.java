package com.branchload.reporting.dto.group;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Group definition file: branches[].groups[] with staff names (source) or staff ids (resolved)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GroupConfigDocument {

    @JsonProperty("branches")
    @Builder.Default
    private List<BranchGroupConfig> branches = new ArrayList<>();
}
