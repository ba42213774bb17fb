package com.branchload.reporting.entity.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a single overview check
 */
public enum CheckStatus {
    OK,
    ALERT,
    NO_DATA;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
