package com.branchload.reporting.dto.platform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw booking record as returned by the scheduling platform.
 * All scalars are kept as text; the normalizer does the parsing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawBookingDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("staff_id")
    private String staffId;

    @JsonProperty("attendance")
    private String attendance;

    @JsonProperty("visit_attendance")
    private String visitAttendance;

    @JsonProperty("datetime")
    private String datetime;

    @JsonProperty("date")
    private String date;

    @JsonProperty("seance_length")
    private String seanceLength;

    @JsonProperty("length")
    private String length;

    @JsonProperty("last_change_date")
    private String lastChangeDate;

    @JsonProperty("create_date")
    private String createDate;
}
