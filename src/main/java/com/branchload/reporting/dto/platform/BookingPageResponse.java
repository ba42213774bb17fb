package com.branchload.reporting.dto.platform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of bookings: data + meta.total_count
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BookingPageResponse implements ApiEnvelope {

    @JsonProperty("success")
    private Boolean success;

    @JsonProperty("data")
    @Builder.Default
    private List<RawBookingDto> data = new ArrayList<>();

    @JsonProperty("meta")
    private ApiMeta meta;

    // Helper methods
    public int getRecordCount() {
        return data != null ? data.size() : 0;
    }

    public int getTotalCount() {
        return meta != null && meta.getTotalCount() != null ? meta.getTotalCount() : 0;
    }
}
