package com.example.accountscheduler.service.retry;

import com.example.accountscheduler.domain.enums.JobStatus;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * What to do with a job after a failed attempt.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RetryDecision {

    private final JobStatus nextStatus;

    /**
     * New due time; null when the job does not run again
     */
    private final Instant nextScheduledAt;

    public static RetryDecision retryAt(Instant nextScheduledAt) {
        return new RetryDecision(JobStatus.RETRYING, nextScheduledAt);
    }

    public static RetryDecision fail() {
        return new RetryDecision(JobStatus.FAILED, null);
    }

    public boolean isTerminal() {
        return nextStatus.isTerminal();
    }
}
