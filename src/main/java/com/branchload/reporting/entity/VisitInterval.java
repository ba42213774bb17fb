package com.branchload.reporting.entity;

import com.branchload.reporting.entity.enums.AttendanceClass;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * VisitInterval Entity - Maps to raw_records table
 * Canonical visit produced by the normalizer; start/end carry the deployment timezone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisitInterval {

    private Long branchId;
    private Long staffId;
    private Long recordId;
    private ZonedDateTime start;
    private ZonedDateTime end;
    private Integer attendanceCode;

    @Builder.Default
    private AttendanceClass attendanceClass = AttendanceClass.FACT;

    /** Last change timestamp as reported upstream, kept verbatim. */
    private String updatedAt;
}
