package com.branchload.reporting.api.client;

import lombok.Getter;

/**
 * Raised when the scheduling platform cannot serve a request: retries exhausted,
 * a client error, or an explicit success=false envelope.
 */
@Getter
public class SchedulingApiException extends RuntimeException {

    /** HTTP status of the last attempt, or null when no response was received. */
    private final Integer statusCode;

    public SchedulingApiException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SchedulingApiException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public boolean isClientError() {
        return statusCode != null && statusCode >= 400 && statusCode < 500;
    }
}
