package com.example.accountscheduler.service;

import com.example.accountscheduler.config.SchedulerProperties;
import com.example.accountscheduler.domain.entity.AccountLock;
import com.example.accountscheduler.domain.enums.JobStatus;
import com.example.accountscheduler.domain.repository.JobExecutionLogRepository;
import com.example.accountscheduler.domain.repository.JobRepository;
import com.example.accountscheduler.dto.EnqueueJobRequest;
import com.example.accountscheduler.dto.JobResponse;
import com.example.accountscheduler.dto.QueueReport;
import com.example.accountscheduler.exception.JobNotFoundException;
import com.example.accountscheduler.exception.JobValidationException;
import com.example.accountscheduler.mapper.JobMapper;
import com.example.accountscheduler.service.lock.AccountLockManager;
import com.example.accountscheduler.service.queue.NewJob;
import com.example.accountscheduler.service.queue.QueueManager;
import com.example.accountscheduler.time.UtcTimestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.UUID;

/**
 * Operator-facing job operations shared by the HTTP API and the CLI.
 * <p>
 * Provides:
 * - Enqueueing from textual timestamps
 * - Job lookup with attempt history
 * - Cancellation
 * - Queue report
 * - Retention cleanup
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobManagementService {

    static final int REPORT_LIST_LIMIT = 50;

    private final JobRepository jobRepository;
    private final JobExecutionLogRepository executionLogRepository;
    private final QueueManager queueManager;
    private final AccountLockManager lockManager;
    private final JobMapper jobMapper;
    private final SchedulerProperties properties;
    private final Clock clock;

    /**
     * Parse the request's timestamp as UTC and enqueue the job
     *
     * @throws JobValidationException if the timestamp is malformed, offset-less or not in the future
     */
    public JobResponse enqueue(EnqueueJobRequest request) {
        var scheduledAt = parseScheduledAt(request.getScheduledAt());

        var job = queueManager.enqueue(NewJob.builder()
                .platform(request.getPlatform())
                .accountId(request.getAccountId())
                .contentRef(request.getContentRef())
                .scheduledAt(scheduledAt)
                .maxRetries(request.getMaxRetries())
                .proxyId(request.getProxyId())
                .metadata(request.getMetadata())
                .build());

        return jobMapper.toResponse(job);
    }

    @Transactional(readOnly = true)
    public JobResponse getJob(UUID jobId) {
        return jobRepository.findById(jobId)
                .map(jobMapper::toResponse)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Transactional(readOnly = true)
    public JobResponse getJobWithHistory(UUID jobId) {
        var response = getJob(jobId);
        var logs = executionLogRepository.findByJobIdOrderByAttemptNumberDesc(jobId);
        response.setExecutionHistory(jobMapper.toLogResponses(logs));
        return response;
    }

    @Transactional(readOnly = true)
    public Page<JobResponse> listJobs(JobStatus status, Pageable pageable) {
        var page = status != null ? jobRepository.findByStatus(status, pageable) : jobRepository.findAll(pageable);
        return page.map(jobMapper::toResponse);
    }

    public JobResponse cancel(UUID jobId) {
        return jobMapper.toResponse(queueManager.cancel(jobId));
    }

    @Transactional(readOnly = true)
    public QueueReport report() {
        var now = clock.instant();

        var statusCounts = new LinkedHashMap<String, Long>();
        for (var status : JobStatus.values()) {
            statusCounts.put(status.name(), 0L);
        }
        for (var row : jobRepository.getJobStatsByStatus()) {
            statusCounts.put(((JobStatus) row[0]).name(), (Long) row[1]);
        }

        var topFailures = PageRequest.of(0, REPORT_LIST_LIMIT);

        return QueueReport.builder()
                .statusDistribution(statusCounts)
                .queueDepth(jobRepository.countDue(now))
                .leasedAccounts(lockManager.liveLeases(now).stream().map(AccountLock::getAccountId).toList())
                .retriesExhausted(jobMapper.toResponseList(jobRepository.findRetriesExhausted(topFailures)))
                .permanentFailures(jobMapper.toResponseList(jobRepository.findPermanentFailures(topFailures)))
                .generatedAt(now)
                .build();
    }

    /**
     * Delete terminal jobs, and their attempt history, completed before the retention period
     *
     * @return number of jobs deleted
     */
    @Transactional
    public int cleanupOldJobs() {
        var cutoff = clock.instant().minus(properties.getRetention());
        var ids = jobRepository.findTerminalIdsCompletedBefore(cutoff);
        if (ids.isEmpty()) {
            return 0;
        }

        var logsDeleted = executionLogRepository.deleteByJobIds(ids);
        var jobsDeleted = jobRepository.deleteByIds(ids);

        log.info("Cleaned up {} terminal jobs and {} execution logs completed before {}",
                jobsDeleted, logsDeleted, UtcTimestamps.format(cutoff));
        return jobsDeleted;
    }

    private Instant parseScheduledAt(String value) {
        try {
            return UtcTimestamps.parse(value);
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("scheduledAt", e.getMessage());
        }
    }
}
