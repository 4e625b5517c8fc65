package com.example.accountscheduler.service.retry;

import com.example.accountscheduler.config.SchedulerProperties;
import com.example.accountscheduler.domain.enums.ErrorKind;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * Decides what happens after a failed attempt and how long to wait before the next one.
 * <p>
 * Backoff for the k-th retry (k starting at 0) is {@code min(cap, base * 2^k) + uniform(0, jitterMax)}.
 * Rate-limited outcomes never consume a retry; they are rescheduled by the caller.
 */
@Component
public class RetryPolicy {

    private final Duration base;
    private final Duration cap;
    private final Duration jitterMax;
    private final RandomGenerator random;

    @Autowired
    public RetryPolicy(SchedulerProperties properties) {
        this(properties.getBackoffBase(), properties.getBackoffCap(), properties.getBackoffJitterMax(), ThreadLocalRandom.current());
    }

    public RetryPolicy(Duration base, Duration cap, Duration jitterMax, RandomGenerator random) {
        if (base.isNegative() || cap.compareTo(base) < 0 || jitterMax.isNegative()) {
            throw new IllegalArgumentException("Backoff requires 0 <= base <= cap and jitterMax >= 0");
        }
        this.base = base;
        this.cap = cap;
        this.jitterMax = jitterMax;
        this.random = random;
    }

    /**
     * Outcome for a failed attempt of a job that has used {@code retryCount} of {@code maxRetries}
     */
    public RetryDecision decide(ErrorKind kind, int retryCount, int maxRetries, Instant now) {
        return switch (kind) {
            case PERMANENT -> RetryDecision.fail();
            case TRANSIENT -> retryCount < maxRetries
                    ? RetryDecision.retryAt(now.plus(backoff(retryCount)))
                    : RetryDecision.fail();
            case RATE_LIMITED -> throw new IllegalArgumentException("Rate-limited outcomes are rescheduled by the rate limiter");
        };
    }

    /**
     * Delay before retry number {@code k}, jitter included
     */
    public Duration backoff(int k) {
        var delay = exponentialDelay(k);
        var jitterMs = jitterMax.toMillis();
        if (jitterMs > 0) {
            delay = delay.plusMillis(random.nextLong(jitterMs + 1));
        }
        return delay;
    }

    /**
     * Deterministic part of the delay: {@code min(cap, base * 2^k)}, saturating instead of overflowing
     */
    public Duration exponentialDelay(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("Retry index must be >= 0: " + k);
        }
        var baseMs = base.toMillis();
        var capMs = cap.toMillis();
        if (k >= Long.SIZE - 1 || baseMs > (capMs >> k)) {
            return cap;
        }
        return Duration.ofMillis(Math.min(capMs, baseMs << k));
    }
}
