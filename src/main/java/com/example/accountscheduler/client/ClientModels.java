package com.example.accountscheduler.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request/Response DTOs for the automation service client
 */
public class ClientModels {
    private ClientModels() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AutomationRequest {
        private String jobId;
        private String platform;
        private String accountId;
        private String proxyId;
        private String contentRef;
        private int attempt;
        private Map<String, Object> metadata;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AutomationResponse {
        /**
         * POSTED, RETRYABLE_ERROR, REJECTED or RATE_LIMITED
         */
        private String outcome;
        private String externalId;
        private String message;
        private Long retryAfterSeconds;
    }
}
