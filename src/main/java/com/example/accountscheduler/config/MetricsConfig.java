package com.example.accountscheduler.config;

import com.example.accountscheduler.domain.enums.ErrorKind;
import com.example.accountscheduler.domain.enums.JobStatus;
import com.example.accountscheduler.domain.enums.Platform;
import com.example.accountscheduler.domain.repository.AccountLockRepository;
import com.example.accountscheduler.domain.repository.JobRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring scheduler health.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job counts by status and queue depth
 * - Accounts under lease
 * - Execution times per platform and outcome
 * - Failures, retries, rate-limit deferrals, lease conflicts and reclaims
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final JobRepository jobRepository;
    private final AccountLockRepository lockRepository;
    private final Clock clock;

    private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var status : JobStatus.values()) {
            var key = "status_" + status.getCode();
            gauges.put(key, new AtomicLong(0));

            Gauge.builder("account_scheduler_jobs", gauges.get(key), AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of jobs by status")
                    .register(meterRegistry);
        }

        gauges.put("queue_depth", new AtomicLong(0));
        Gauge.builder("account_scheduler_queue_depth", gauges.get("queue_depth"), AtomicLong::get)
                .description("Number of claimable jobs already due")
                .register(meterRegistry);

        gauges.put("leased_accounts", new AtomicLong(0));
        Gauge.builder("account_scheduler_leased_accounts", gauges.get("leased_accounts"), AtomicLong::get)
                .description("Number of accounts holding a live lease")
                .register(meterRegistry);
    }

    /**
     * Periodically update gauge metrics from database
     */
    @Scheduled(fixedDelayString = "${account-scheduler.housekeeping.metrics-interval-ms:60000}")
    public void updateMetrics() {
        try {
            var now = clock.instant();
            for (var status : JobStatus.values()) {
                gauges.get("status_" + status.getCode()).set(jobRepository.countByStatus(status));
            }
            gauges.get("queue_depth").set(jobRepository.countDue(now));
            gauges.get("leased_accounts").set(lockRepository.countLive(now));
        } catch (Exception e) {
            log.warn("Failed to refresh scheduler gauges: {}", e.getMessage());
        }
    }

    public Timer.Sample startExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record execution time; outcome is "success" or the lower-case error kind
     */
    public void recordExecution(Timer.Sample sample, Platform platform, String outcome) {
        sample.stop(Timer.builder("account_scheduler_execution_time")
                .tag("platform", platform.getCode())
                .tag("outcome", outcome)
                .description("Executor invocation time")
                .register(meterRegistry));
    }

    public void recordFailure(Platform platform, ErrorKind kind) {
        meterRegistry.counter("account_scheduler_failures",
                "platform", platform.getCode(),
                "kind", kind.name().toLowerCase()
        ).increment();
    }

    public void recordRetry(Platform platform, int attemptNumber) {
        meterRegistry.counter("account_scheduler_retries",
                "platform", platform.getCode(),
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordRetriesExhausted(Platform platform) {
        meterRegistry.counter("account_scheduler_retries_exhausted",
                "platform", platform.getCode()
        ).increment();
    }

    public void recordRateLimitDeferral(Platform platform) {
        meterRegistry.counter("account_scheduler_rate_limit_deferrals",
                "platform", platform.getCode()
        ).increment();
    }

    public void recordLeaseConflict() {
        meterRegistry.counter("account_scheduler_lease_conflicts").increment();
    }

    public void recordReclaimedLeases(int count) {
        if (count > 0) {
            meterRegistry.counter("account_scheduler_reclaimed_jobs").increment(count);
        }
    }
}
