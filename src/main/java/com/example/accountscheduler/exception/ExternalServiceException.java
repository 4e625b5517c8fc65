package com.example.accountscheduler.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Exception for external service communication failures
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;
    private final Integer httpStatusCode;
    private final String responseBody;
    private final boolean retryable;
    private final Duration retryAfter;

    public ExternalServiceException(String serviceName, String message) {
        super(String.format("[%s] %s", serviceName, message));
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.retryable = true;
        this.retryAfter = null;
    }

    public ExternalServiceException(String serviceName, String message, Throwable cause) {
        super(String.format("[%s] %s", serviceName, message), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.retryable = true;
        this.retryAfter = null;
    }

    public ExternalServiceException(String serviceName, int httpStatusCode, String responseBody, Duration retryAfter) {
        super(String.format("[%s] HTTP %d: %s", serviceName, httpStatusCode, responseBody));
        this.serviceName = serviceName;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
        this.retryAfter = retryAfter;
        // 4xx errors (except 408, 429) are not retryable
        this.retryable = httpStatusCode >= 500 || httpStatusCode == 408 || httpStatusCode == 429;
    }

    public boolean isRateLimited() {
        return httpStatusCode != null && httpStatusCode == 429;
    }
}
