package com.branchload.reporting.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Scheduling platform API settings
 */
@Configuration
@ConfigurationProperties(prefix = "scheduling-api")
@Data
public class SchedulingApiConfig {

    private String baseUrl = "https://api.yclients.com";

    private String partnerToken;

    private String userToken;

    private int timeoutSeconds = 30;

    private int maxRetries = 3;

    private long backoffBaseMs = 1000;

    private long backoffCapMs = 10_000;

    public String authorizationHeader() {
        String auth = "Bearer " + (partnerToken == null ? "" : partnerToken);
        if (userToken != null && !userToken.isBlank()) {
            auth = auth + ", User " + userToken;
        }
        return auth;
    }

    /**
     * Delay before the next attempt: base * 2^attempt, capped
     */
    public long backoffDelayMs(int attempt) {
        long delay = backoffBaseMs * (1L << Math.min(attempt, 20));
        return Math.min(delay, backoffCapMs);
    }
}
