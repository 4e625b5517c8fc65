package com.example.accountscheduler.service.executor;

import com.example.accountscheduler.domain.enums.ErrorKind;
import com.example.accountscheduler.exception.JobExecutionException;
import com.example.accountscheduler.exception.RateLimitedException;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Outcome of one executor invocation.
 * <p>
 * Contains everything needed to move the job on and to write its execution log.
 */
@Data
@Builder
public class ExecutionResult {

    private boolean success;

    /**
     * Failure classification, null on success
     */
    private ErrorKind errorKind;

    private String message;

    /**
     * Wall-clock time spent in the executor
     */
    private Duration duration;

    /**
     * Platform-suggested wait for rate-limited outcomes
     */
    private Duration retryAfter;

    public static ExecutionResult success() {
        return ExecutionResult.builder().success(true).build();
    }

    public static ExecutionResult success(String message) {
        return ExecutionResult.builder().success(true).message(message).build();
    }

    public static ExecutionResult transientFailure(String message) {
        return failure(ErrorKind.TRANSIENT, message);
    }

    public static ExecutionResult permanentFailure(String message) {
        return failure(ErrorKind.PERMANENT, message);
    }

    public static ExecutionResult rateLimited(String message, Duration retryAfter) {
        return ExecutionResult.builder()
                .success(false)
                .errorKind(ErrorKind.RATE_LIMITED)
                .message(message)
                .retryAfter(retryAfter)
                .build();
    }

    /**
     * Executor exceeded its wall-clock budget; counts as transient
     */
    public static ExecutionResult timedOut(Duration timeout) {
        return ExecutionResult.builder()
                .success(false)
                .errorKind(ErrorKind.TRANSIENT)
                .message("Execution timed out after " + timeout)
                .duration(timeout)
                .build();
    }

    /**
     * Classify a thrown exception; anything unrecognised is transient
     */
    public static ExecutionResult failure(Throwable e) {
        var message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (e instanceof RateLimitedException rateLimited) {
            return rateLimited(message, rateLimited.getRetryAfter());
        }
        if (e instanceof JobExecutionException executionException) {
            return failure(executionException.getKind(), message);
        }
        return transientFailure(e.getClass().getSimpleName() + ": " + message);
    }

    private static ExecutionResult failure(ErrorKind kind, String message) {
        return ExecutionResult.builder()
                .success(false)
                .errorKind(kind)
                .message(message)
                .build();
    }

    public ExecutionResult withDuration(Duration duration) {
        this.duration = duration;
        return this;
    }
}
