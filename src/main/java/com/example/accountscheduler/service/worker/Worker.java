package com.example.accountscheduler.service.worker;

import com.example.accountscheduler.config.MetricsConfig;
import com.example.accountscheduler.domain.entity.Job;
import com.example.accountscheduler.service.executor.ExecutionResult;
import com.example.accountscheduler.service.executor.JobExecutorRegistry;
import com.example.accountscheduler.service.queue.ClaimedJob;
import com.example.accountscheduler.service.queue.QueueManager;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * One independent poll loop: claim, execute under a hard timeout, complete.
 * <p>
 * Nothing escapes the loop. If a completion cannot be recorded the lease expires
 * and the job is reclaimed by the next scan.
 */
@Slf4j
public class Worker implements Runnable {

    @Getter
    private final String workerId;
    private final QueueManager queueManager;
    private final JobExecutorRegistry executorRegistry;
    private final ExecutorService invocationExecutor;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration executionTimeout;

    private volatile boolean running = true;

    public Worker(String workerId, QueueManager queueManager, JobExecutorRegistry executorRegistry,
                  ExecutorService invocationExecutor, MetricsConfig metricsConfig, Clock clock,
                  Duration pollInterval, Duration executionTimeout) {
        this.workerId = workerId;
        this.queueManager = queueManager;
        this.executorRegistry = executorRegistry;
        this.invocationExecutor = invocationExecutor;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.executionTimeout = executionTimeout;
    }

    @Override
    public void run() {
        log.info("Worker {} started", workerId);
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                if (!pollOnce()) {
                    Thread.sleep(pollInterval.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.error("Worker {} poll cycle failed: {}", workerId, e.getMessage(), e);
                pause();
            }
        }
        log.info("Worker {} stopped", workerId);
    }

    public void stop() {
        running = false;
    }

    /**
     * Claim and process at most one job.
     *
     * @return true if a job was processed
     */
    public boolean pollOnce() {
        var claimed = queueManager.claimNext(clock.instant(), workerId);
        if (claimed.isEmpty()) {
            log.debug("Worker {} found no eligible job", workerId);
            return false;
        }
        process(claimed.get());
        return true;
    }

    void process(ClaimedJob claimed) {
        var job = claimed.getJob();
        var result = execute(job);

        try {
            queueManager.complete(job.getId(), workerId, result);
        } catch (Exception e) {
            log.error("Worker {} could not record completion of job {}; lease expiry will recover it: {}",
                    workerId, job.getId(), e.getMessage(), e);
        }
    }

    ExecutionResult execute(Job job) {
        var executor = executorRegistry.getExecutor(job.getPlatform());
        if (executor.isEmpty()) {
            return ExecutionResult.permanentFailure("No executor registered for platform " + job.getPlatform());
        }

        var timerSample = metricsConfig.startExecutionTimer();
        var startedNanos = System.nanoTime();
        var result = invoke(job, executor.get()::execute);

        if (result.getDuration() == null) {
            result.withDuration(Duration.ofNanos(System.nanoTime() - startedNanos));
        }
        var outcome = result.isSuccess()
                ? "success"
                : result.getErrorKind() != null ? result.getErrorKind().name().toLowerCase() : "transient";
        metricsConfig.recordExecution(timerSample, job.getPlatform(), outcome);
        return result;
    }

    private ExecutionResult invoke(Job job, Function<Job, ExecutionResult> call) {
        final Future<ExecutionResult> future;
        try {
            future = invocationExecutor.submit(() -> call.apply(job));
        } catch (RejectedExecutionException e) {
            return ExecutionResult.transientFailure("Executor pool rejected job: " + e.getMessage());
        }

        try {
            var result = future.get(executionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : ExecutionResult.transientFailure("Executor returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Job {} exceeded the execution timeout of {}; cancelled", job.getId(), executionTimeout);
            return ExecutionResult.timedOut(executionTimeout);
        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Executor for job {} threw {}: {}", job.getId(), cause.getClass().getSimpleName(), cause.getMessage());
            return ExecutionResult.failure(cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ExecutionResult.transientFailure("Worker interrupted while job was running");
        }
    }

    private void pause() {
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
