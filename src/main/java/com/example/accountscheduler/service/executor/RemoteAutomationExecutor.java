package com.example.accountscheduler.service.executor;

import com.example.accountscheduler.client.AutomationServiceClient;
import com.example.accountscheduler.client.ClientModels.AutomationRequest;
import com.example.accountscheduler.domain.entity.Job;
import com.example.accountscheduler.domain.enums.Platform;
import com.example.accountscheduler.exception.ExternalServiceException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Executes jobs of one platform by delegating to the automation service.
 * <p>
 * Outcome mapping:
 * - POSTED: success
 * - REJECTED, HTTP 400/401/403/404/409/422: permanent
 * - RATE_LIMITED, HTTP 429: rate-limited, honouring the suggested wait
 * - RETRYABLE_ERROR, HTTP 5xx/408, I/O errors, open circuit: transient
 */
@Slf4j
public class RemoteAutomationExecutor implements JobExecutor {

    private final Platform platform;
    private final AutomationServiceClient client;

    public RemoteAutomationExecutor(Platform platform, AutomationServiceClient client) {
        this.platform = platform;
        this.client = client;
    }

    @Override
    public Platform getPlatform() {
        return platform;
    }

    @Override
    public ExecutionResult execute(Job job) {
        var request = AutomationRequest.builder()
                .jobId(job.getId().toString())
                .platform(platform.getCode())
                .accountId(job.getAccountId())
                .proxyId(job.getProxyId())
                .contentRef(job.getContentRef())
                .attempt(job.getRetryCount() + 1)
                .metadata(job.getMetadata())
                .build();

        try {
            var response = client.publish(request);
            if (response == null || response.getOutcome() == null) {
                return ExecutionResult.transientFailure("Empty response from automation service");
            }

            var message = response.getMessage();
            return switch (response.getOutcome().toUpperCase()) {
                case "POSTED" -> {
                    log.info("Job {} posted to {} as {}", job.getId(), platform, response.getExternalId());
                    yield ExecutionResult.success(response.getExternalId() != null ? "Posted as " + response.getExternalId() : message);
                }
                case "REJECTED" -> ExecutionResult.permanentFailure(message != null ? message : "Rejected by platform");
                case "RATE_LIMITED" -> ExecutionResult.rateLimited(
                        message != null ? message : "Rate limited by platform",
                        response.getRetryAfterSeconds() != null ? Duration.ofSeconds(response.getRetryAfterSeconds()) : null);
                default -> ExecutionResult.transientFailure(
                        String.format("Outcome %s: %s", response.getOutcome(), message));
            };
        } catch (ExternalServiceException e) {
            return classify(e);
        }
    }

    private ExecutionResult classify(ExternalServiceException e) {
        if (e.isRateLimited()) {
            return ExecutionResult.rateLimited(e.getMessage(), e.getRetryAfter());
        }
        if (e.getHttpStatusCode() != null && !e.isRetryable()) {
            return ExecutionResult.permanentFailure(e.getMessage());
        }
        return ExecutionResult.transientFailure(e.getMessage());
    }
}
