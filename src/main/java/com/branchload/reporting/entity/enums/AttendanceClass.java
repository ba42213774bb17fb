package com.branchload.reporting.entity.enums;

import java.util.Set;

/**
 * Attendance classification of a booking
 */
public enum AttendanceClass {
    FACT,
    NON_FACT;

    /** Platform attendance codes meaning the client actually came. */
    public static final Set<Integer> FACT_CODES = Set.of(1, 2);

    public static AttendanceClass fromCode(int code) {
        return FACT_CODES.contains(code) ? FACT : NON_FACT;
    }
}
