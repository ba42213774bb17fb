package com.branchload.reporting.dto.group;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
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
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class GroupConfig {

    @JsonProperty("group_id")
    private String groupId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("staff_names")
    @Builder.Default
    private List<String> staffNames = new ArrayList<>();

    @JsonProperty("staff_ids")
    @Builder.Default
    private List<Long> staffIds = new ArrayList<>();
}
