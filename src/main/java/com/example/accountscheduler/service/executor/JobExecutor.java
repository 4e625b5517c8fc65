package com.example.accountscheduler.service.executor;

import com.example.accountscheduler.domain.entity.Job;
import com.example.accountscheduler.domain.enums.Platform;

/**
 * Performs the action a job describes on one platform.
 * <p>
 * Implementations should:
 * - Be stateless
 * - Classify their own failures (transient, permanent, rate-limited)
 * - Not manage transactions or leases (handled by the queue)
 * <p>
 * Throwing a {@link com.example.accountscheduler.exception.JobExecutionException} is equivalent
 * to returning the matching failure result; any other exception counts as transient.
 */
public interface JobExecutor {

    Platform getPlatform();

    ExecutionResult execute(Job job);
}
