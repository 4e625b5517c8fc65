package com.example.accountscheduler.service.queue;

import com.example.accountscheduler.config.MetricsConfig;
import com.example.accountscheduler.config.SchedulerProperties;
import com.example.accountscheduler.domain.entity.Job;
import com.example.accountscheduler.domain.entity.JobError;
import com.example.accountscheduler.domain.entity.JobExecutionLog;
import com.example.accountscheduler.domain.enums.ErrorKind;
import com.example.accountscheduler.domain.enums.JobStatus;
import com.example.accountscheduler.domain.repository.JobExecutionLogRepository;
import com.example.accountscheduler.domain.repository.JobRepository;
import com.example.accountscheduler.exception.InvalidJobStateException;
import com.example.accountscheduler.exception.JobNotFoundException;
import com.example.accountscheduler.exception.JobValidationException;
import com.example.accountscheduler.exception.LockConflictException;
import com.example.accountscheduler.service.AccountDirectory;
import com.example.accountscheduler.service.alert.SlackAlertService;
import com.example.accountscheduler.service.executor.ExecutionResult;
import com.example.accountscheduler.service.lock.AccountLockManager;
import com.example.accountscheduler.service.ratelimit.RateLimiter;
import com.example.accountscheduler.service.retry.RetryPolicy;
import com.example.accountscheduler.time.UtcTimestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the job lifecycle: admission, claiming, completion and cancellation.
 * <p>
 * Claiming composes three things in one transaction:
 * - due candidates locked with FOR UPDATE SKIP LOCKED
 * - an account lease (compare-and-insert)
 * - a rate-window increment
 * <p>
 * so that a job only turns RUNNING when its account is exclusively held and has budget left.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueManager {

    private final JobRepository jobRepository;
    private final JobExecutionLogRepository executionLogRepository;
    private final AccountLockManager lockManager;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final AccountDirectory accountDirectory;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final SchedulerProperties properties;
    private final Clock clock;

    /**
     * Validate and persist a new QUEUED job.
     *
     * @throws JobValidationException if the request is incomplete or not scheduled in the future
     */
    @Transactional
    public Job enqueue(NewJob newJob) {
        var now = clock.instant();
        validate(newJob, now);

        var maxRetries = newJob.getMaxRetries() != null ? newJob.getMaxRetries() : properties.getDefaultMaxRetries();

        var job = Job.builder()
                .platform(newJob.getPlatform())
                .accountId(newJob.getAccountId().trim())
                .contentRef(newJob.getContentRef().trim())
                .proxyId(newJob.getProxyId())
                .scheduledAt(newJob.getScheduledAt())
                .status(JobStatus.QUEUED)
                .retryCount(0)
                .maxRetries(maxRetries)
                .metadata(newJob.getMetadata() != null ? new HashMap<>(newJob.getMetadata()) : new HashMap<>())
                .createdAt(now)
                .updatedAt(now)
                .build();

        var saved = jobRepository.save(job);
        log.info("Enqueued job {} ({} / {}) for {}", saved.getId(), saved.getPlatform(), saved.getAccountId(),
                UtcTimestamps.format(saved.getScheduledAt()));
        return saved;
    }

    /**
     * Claim the earliest due job whose account can be leased and still has rate budget.
     *
     * @return the claimed job, or empty when nothing is eligible right now
     */
    @Transactional
    public Optional<ClaimedJob> claimNext(Instant now, String ownerId) {
        reclaimExpiredLeases(now);

        var candidates = jobRepository.findClaimCandidates(now, properties.getClaimBatchSize());
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        var triedAccounts = new HashSet<String>();
        for (var job : candidates) {
            if (!triedAccounts.add(job.getAccountId())) {
                continue;
            }
            try {
                var claimed = tryClaim(job, ownerId, now);
                if (claimed.isPresent()) {
                    return claimed;
                }
            } catch (LockConflictException e) {
                metricsConfig.recordLeaseConflict();
                log.debug("Skipping job {}: {}", job.getId(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    private Optional<ClaimedJob> tryClaim(Job job, String ownerId, Instant now) {
        var ttl = properties.getLeaseTtl();
        if (!lockManager.acquire(job.getAccountId(), ownerId, ttl, now)) {
            throw new LockConflictException(job.getAccountId());
        }

        if (!rateLimiter.checkAndIncrement(job.getAccountId(), job.getPlatform(), now)) {
            lockManager.release(job.getAccountId(), ownerId);
            var resetAt = rateLimiter.windowResetAt(job.getAccountId(), job.getPlatform(), now);
            job.setScheduledAt(resetAt);
            job.setUpdatedAt(now);
            var deferred = jobRepository.deferAccountJobs(job.getAccountId(), job.getPlatform().name(), resetAt, now);
            metricsConfig.recordRateLimitDeferral(job.getPlatform());
            log.warn("Rate limit reached for account {} on {}; job {} and {} more deferred to {}",
                    job.getAccountId(), job.getPlatform(), job.getId(), deferred, UtcTimestamps.format(resetAt));
            return Optional.empty();
        }

        if (job.getProxyId() == null) {
            accountDirectory.proxyFor(job.getAccountId()).ifPresent(job::setProxyId);
        }

        var expiresAt = now.plus(ttl);
        job.claim(ownerId, now, expiresAt);
        var saved = jobRepository.save(job);

        log.info("Job {} claimed by {} (account {}, attempt {}, lease until {})",
                saved.getId(), ownerId, saved.getAccountId(), saved.getRetryCount() + 1, expiresAt);
        return Optional.of(new ClaimedJob(saved, ownerId, expiresAt));
    }

    /**
     * Record the outcome of a claimed job and release its account.
     * <p>
     * A completion from a worker that no longer owns the claim (lease reclaimed, job re-claimed)
     * is logged and ignored.
     */
    @Transactional
    public void complete(UUID jobId, String ownerId, ExecutionResult result) {
        var now = clock.instant();
        var job = jobRepository.findByIdForUpdate(jobId).orElse(null);
        if (job == null) {
            log.warn("Completion for unknown job {} from {} ignored", jobId, ownerId);
            return;
        }

        if (!job.isClaimedBy(ownerId)) {
            log.warn("Stale completion for job {} from {} ignored (status {}, claimed by {})",
                    jobId, ownerId, job.getStatus(), job.getClaimedBy());
            lockManager.release(job.getAccountId(), ownerId);
            return;
        }

        var startedAt = job.getClaimedAt();
        var attemptNumber = (int) executionLogRepository.countByJobId(jobId) + 1;

        if (result.isSuccess()) {
            handleSuccess(job, now);
        } else {
            var kind = result.getErrorKind() != null ? result.getErrorKind() : ErrorKind.TRANSIENT;
            job.setLastError(JobError.of(kind, result.getMessage(), now));
            metricsConfig.recordFailure(job.getPlatform(), kind);

            switch (kind) {
                case PERMANENT -> handlePermanentFailure(job, now);
                case TRANSIENT -> handleTransientFailure(job, now);
                case RATE_LIMITED -> handleRateLimited(job, result.getRetryAfter(), now);
            }
        }

        jobRepository.save(job);
        executionLogRepository.save(buildExecutionLog(job, ownerId, attemptNumber, startedAt, now, result));
        lockManager.release(job.getAccountId(), ownerId);
    }

    private void handleSuccess(Job job, Instant now) {
        job.transitionTo(JobStatus.DONE, now);
        log.info("Job {} completed successfully on attempt {}", job.getId(), job.getRetryCount() + 1);
    }

    private void handlePermanentFailure(Job job, Instant now) {
        job.transitionTo(JobStatus.FAILED, now);
        log.error("Job {} failed permanently: {}", job.getId(), job.getLastError().getMessage());
        slackAlertService.sendPermanentFailureAlert(job);
    }

    private void handleTransientFailure(Job job, Instant now) {
        var decision = retryPolicy.decide(ErrorKind.TRANSIENT, job.getRetryCount(), job.getMaxRetries(), now);

        if (decision.isTerminal()) {
            job.transitionTo(JobStatus.FAILED, now);
            metricsConfig.recordRetriesExhausted(job.getPlatform());
            log.error("Job {} exhausted its {} retries: {}", job.getId(), job.getMaxRetries(), job.getLastError().getMessage());
            slackAlertService.sendRetriesExhaustedAlert(job);
            return;
        }

        job.transitionTo(decision.getNextStatus(), now);
        job.setScheduledAt(decision.getNextScheduledAt());
        job.setRetryCount(job.getRetryCount() + 1);
        metricsConfig.recordRetry(job.getPlatform(), job.getRetryCount());
        log.info("Scheduling retry {}/{} for job {} at {}", job.getRetryCount(), job.getMaxRetries(), job.getId(),
                UtcTimestamps.format(decision.getNextScheduledAt()));
    }

    private void handleRateLimited(Job job, Duration retryAfter, Instant now) {
        var resetAt = rateLimiter.markExhausted(job.getAccountId(), job.getPlatform(), now);
        var next = resetAt;
        if (retryAfter != null && now.plus(retryAfter).isAfter(next)) {
            next = now.plus(retryAfter);
        }

        job.transitionTo(JobStatus.QUEUED, now);
        job.setScheduledAt(next);
        metricsConfig.recordRateLimitDeferral(job.getPlatform());
        log.warn("Job {} rate limited by {}; re-queued for {} without using a retry", job.getId(), job.getPlatform(),
                UtcTimestamps.format(next));
    }

    private JobExecutionLog buildExecutionLog(Job job, String ownerId, int attemptNumber, Instant startedAt, Instant now,
                                              ExecutionResult result) {
        var started = startedAt != null ? startedAt : now;
        var durationMs = result.getDuration() != null
                ? result.getDuration().toMillis()
                : Duration.between(started, now).toMillis();

        return JobExecutionLog.builder()
                .jobId(job.getId())
                .attemptNumber(attemptNumber)
                .status(job.getStatus())
                .workerId(ownerId)
                .startedAt(started)
                .completedAt(now)
                .durationMs(durationMs)
                .success(result.isSuccess())
                .errorKind(result.isSuccess() ? null : job.getLastError().getKind())
                .errorMessage(result.isSuccess() ? null : job.getLastError().getMessage())
                .createdAt(now)
                .build();
    }

    /**
     * Cancel a job that has not started yet.
     *
     * @throws JobNotFoundException     if there is no such job
     * @throws InvalidJobStateException if the job is not QUEUED
     */
    @Transactional
    public Job cancel(UUID jobId) {
        var now = clock.instant();
        if (jobRepository.cancelIfQueued(jobId, now) == 1) {
            log.info("Job {} cancelled", jobId);
            return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        }

        var job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        throw new InvalidJobStateException(jobId.toString(), job.getStatus().name(), JobStatus.CANCELLED.name());
    }

    /**
     * Put RUNNING jobs whose lease is gone back on the queue and purge dead lease rows.
     *
     * @return number of jobs returned to the queue
     */
    @Transactional
    public int reclaimExpiredLeases(Instant now) {
        var reclaimed = jobRepository.reclaimExpiredClaims(now);
        lockManager.purgeExpired(now);
        if (reclaimed > 0) {
            metricsConfig.recordReclaimedLeases(reclaimed);
            log.warn("Re-queued {} jobs whose worker lease expired", reclaimed);
        }
        return reclaimed;
    }

    private void validate(NewJob newJob, Instant now) {
        if (newJob.getPlatform() == null) {
            throw new JobValidationException("platform", "Platform is required");
        }
        if (newJob.getAccountId() == null || newJob.getAccountId().isBlank()) {
            throw new JobValidationException("accountId", "Account ID is required");
        }
        if (newJob.getContentRef() == null || newJob.getContentRef().isBlank()) {
            throw new JobValidationException("contentRef", "Content reference is required");
        }
        if (newJob.getMaxRetries() != null && newJob.getMaxRetries() < 0) {
            throw new JobValidationException("maxRetries", "Max retries must be >= 0");
        }
        if (newJob.getScheduledAt() == null) {
            throw new JobValidationException("scheduledAt", "Scheduled time is required");
        }
        if (!newJob.getScheduledAt().isAfter(now)) {
            throw new JobValidationException("scheduledAt", String.format(
                    "Scheduled time %s is not in the future (current time: %s)",
                    UtcTimestamps.format(newJob.getScheduledAt()), UtcTimestamps.format(now)));
        }
    }
}
