package com.branchload.reporting.dto.platform;

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
public class StaffListResponse implements ApiEnvelope {

    @JsonProperty("success")
    private Boolean success;

    @JsonProperty("data")
    @Builder.Default
    private List<StaffDto> data = new ArrayList<>();

    @JsonProperty("meta")
    private ApiMeta meta;
}
