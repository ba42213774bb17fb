package com.branchload.reporting.api.client;

import com.branchload.reporting.config.SchedulingApiConfig;
import com.branchload.reporting.dto.platform.ApiEnvelope;
import com.branchload.reporting.dto.platform.BookingPageResponse;
import com.branchload.reporting.dto.platform.StaffListResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scheduling platform API client
 *
 * Retries 5xx responses, timeouts and I/O failures with capped exponential backoff.
 * Client errors and success=false envelopes fail immediately.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SchedulingApiClient {

    private static final String ACCEPT_HEADER = "application/vnd.yclients.v2+json";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final SchedulingApiConfig apiConfig;

    /**
     * Fetch one page of bookings for a branch and date range
     */
    public BookingPageResponse fetchBookings(long branchId, LocalDate startDate, LocalDate endDate,
                                             int page, int count) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("page", page);
        params.put("count", count);
        params.put("start_date", startDate.toString());
        params.put("end_date", endDate.toString());

        return callApiWithRetry("/api/v1/records/" + branchId, params, BookingPageResponse.class);
    }

    /**
     * Fetch the full staff list of a branch. Falls back to the legacy endpoint
     * when the primary one rejects staff id 0.
     */
    public StaffListResponse fetchStaff(long branchId) {
        try {
            return callApiWithRetry("/api/v1/company/" + branchId + "/staff/0", Map.of(), StaffListResponse.class);
        } catch (SchedulingApiException e) {
            if (!e.isClientError()) {
                throw e;
            }
            log.warn("Primary staff endpoint rejected branch {} ({}), using legacy endpoint",
                    branchId, e.getMessage());
            return callApiWithRetry("/api/v1/staff/" + branchId, Map.of(), StaffListResponse.class);
        }
    }

    /**
     * Call API with retry mechanism
     */
    private <T extends ApiEnvelope> T callApiWithRetry(String path, Map<String, Object> params, Class<T> type) {
        String url = buildUrlWithParams(apiConfig.getBaseUrl() + path, params);
        int maxRetries = Math.max(1, apiConfig.getMaxRetries());
        Exception lastException = null;
        Integer lastStatus = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                log.debug("Calling scheduling API - attempt {}/{}, url: {}", attempt, maxRetries, url);

                ResponseEntity<String> response = restTemplate.exchange(
                        url, HttpMethod.GET, createHttpEntity(), String.class);

                T body = parseBody(response.getBody(), type);
                if (body.isExplicitFailure()) {
                    String message = body.getMeta() != null ? body.getMeta().getMessage() : null;
                    throw new SchedulingApiException(
                            "Scheduling API returned success=false for " + path + ": " + message,
                            response.getStatusCode().value());
                }
                return body;

            } catch (HttpClientErrorException e) {
                throw new SchedulingApiException(
                        "Scheduling API rejected " + path + " with status " + e.getStatusCode().value(),
                        e.getStatusCode().value(), e);
            } catch (HttpServerErrorException e) {
                lastException = e;
                lastStatus = e.getStatusCode().value();
                log.warn("Scheduling API server error - attempt {}/{}: {}", attempt, maxRetries, e.getMessage());
            } catch (ResourceAccessException e) {
                lastException = e;
                lastStatus = null;
                log.warn("Scheduling API unreachable - attempt {}/{}: {}", attempt, maxRetries, e.getMessage());
            }

            if (attempt < maxRetries && !sleepBeforeRetry(attempt)) {
                break;
            }
        }

        log.error("Scheduling API call {} failed after {} attempts", path, maxRetries, lastException);
        throw new SchedulingApiException(
                "Scheduling API request failed: " + (lastException != null ? lastException.getMessage() : path),
                lastStatus, lastException);
    }

    private <T> T parseBody(String body, Class<T> type) {
        try {
            String json = body == null || body.isBlank() ? "{}" : body;
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SchedulingApiException("Unreadable scheduling API response: " + e.getOriginalMessage(), null, e);
        }
    }

    private boolean sleepBeforeRetry(int attempt) {
        try {
            Thread.sleep(apiConfig.backoffDelayMs(attempt));
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpEntity<Void> createHttpEntity() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ACCEPT, ACCEPT_HEADER);
        headers.set(HttpHeaders.CONTENT_TYPE, "application/json");
        headers.set(HttpHeaders.AUTHORIZATION, apiConfig.authorizationHeader());
        return new HttpEntity<>(headers);
    }

    private String buildUrlWithParams(String url, Map<String, Object> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(url);
        params.forEach(builder::queryParam);
        return builder.toUriString();
    }
}
