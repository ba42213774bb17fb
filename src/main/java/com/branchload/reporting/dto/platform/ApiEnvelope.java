package com.branchload.reporting.dto.platform;

/**
 * Common shape of platform responses: an explicit success flag plus meta.
 */
public interface ApiEnvelope {

    Boolean getSuccess();

    ApiMeta getMeta();

    default boolean isExplicitFailure() {
        return Boolean.FALSE.equals(getSuccess());
    }
}
