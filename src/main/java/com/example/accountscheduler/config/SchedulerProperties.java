package com.example.accountscheduler.config;

import com.example.accountscheduler.domain.enums.Platform;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the account scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "account-scheduler")
public class SchedulerProperties {

    /**
     * How long an idle worker sleeps before polling again
     */
    @NotNull
    private Duration pollInterval = Duration.ofSeconds(2);

    /**
     * Number of independent worker loops
     */
    @Min(1)
    private int workerCount = 4;

    /**
     * Maximum number of due candidates locked per claim attempt
     */
    @Min(1)
    private int claimBatchSize = 10;

    /**
     * Max retries for jobs that do not set their own
     */
    @Min(0)
    private int defaultMaxRetries = 3;

    @NotNull
    private Duration backoffBase = Duration.ofSeconds(60);

    @NotNull
    private Duration backoffCap = Duration.ofHours(1);

    @NotNull
    private Duration backoffJitterMax = Duration.ofSeconds(30);

    /**
     * Lifetime of an account lease; a crashed worker's account frees up after this
     */
    @NotNull
    private Duration leaseTtl = Duration.ofMinutes(10);

    /**
     * Hard wall-clock limit for a single executor invocation
     */
    @NotNull
    private Duration executionTimeout = Duration.ofMinutes(5);

    /**
     * Length of a fixed rate window
     */
    @NotNull
    private Duration rateWindow = Duration.ofHours(1);

    @Min(1)
    private int defaultRateLimitPerHour = 25;

    /**
     * Per-platform action limit within one rate window
     */
    private Map<Platform, @NotNull @Min(1) Integer> rateLimitPerHour = new HashMap<>();

    /**
     * How long terminal jobs and their history are kept
     */
    @NotNull
    private Duration retention = Duration.ofDays(30);

    @Valid
    private Worker worker = new Worker();

    @Data
    public static class Worker {

        /**
         * Start the worker pool with the application context
         */
        private boolean enabled = true;

        /**
         * Grace period for in-flight jobs on shutdown
         */
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    /**
     * Effective action limit for a platform
     */
    public int rateLimitFor(Platform platform) {
        var limit = rateLimitPerHour.get(platform);
        return limit != null ? limit : defaultRateLimitPerHour;
    }

    @AssertTrue(message = "execution-timeout must not exceed lease-ttl")
    public boolean isExecutionTimeoutWithinLease() {
        return executionTimeout == null || leaseTtl == null || executionTimeout.compareTo(leaseTtl) <= 0;
    }

    @AssertTrue(message = "backoff-cap must not be smaller than backoff-base")
    public boolean isBackoffCapAboveBase() {
        return backoffBase == null || backoffCap == null || backoffCap.compareTo(backoffBase) >= 0;
    }
}
