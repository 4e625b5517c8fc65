package com.example.accountscheduler.service.executor;

import com.example.accountscheduler.domain.enums.ErrorKind;
import com.example.accountscheduler.exception.PermanentExecutionException;
import com.example.accountscheduler.exception.RateLimitedException;
import com.example.accountscheduler.exception.TransientExecutionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExecutionResult Tests")
class ExecutionResultTest {

    @Test
    @DisplayName("Success has no error kind")
    void successHasNoErrorKind() {
        var result = ExecutionResult.success("Posted as 123");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getErrorKind()).isNull();
        assertThat(result.getMessage()).isEqualTo("Posted as 123");
    }

    @Test
    @DisplayName("Timeout counts as transient")
    void timeoutIsTransient() {
        var result = ExecutionResult.timedOut(Duration.ofMinutes(5));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.TRANSIENT);
        assertThat(result.getMessage()).contains("timed out");
        assertThat(result.getDuration()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Executor exceptions keep their classification")
    void executorExceptionsKeepClassification() {
        assertThat(ExecutionResult.failure(new PermanentExecutionException("account banned")).getErrorKind())
                .isEqualTo(ErrorKind.PERMANENT);
        assertThat(ExecutionResult.failure(new TransientExecutionException("proxy reset")).getErrorKind())
                .isEqualTo(ErrorKind.TRANSIENT);

        var rateLimited = ExecutionResult.failure(new RateLimitedException("slow down", Duration.ofMinutes(15)));
        assertThat(rateLimited.getErrorKind()).isEqualTo(ErrorKind.RATE_LIMITED);
        assertThat(rateLimited.getRetryAfter()).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    @DisplayName("Unknown exceptions are transient and name their type")
    void unknownExceptionsAreTransient() {
        var result = ExecutionResult.failure(new IOException("connection reset"));

        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.TRANSIENT);
        assertThat(result.getMessage()).isEqualTo("IOException: connection reset");
    }

    @Test
    @DisplayName("withDuration sets the duration")
    void withDurationSetsDuration() {
        var result = ExecutionResult.permanentFailure("nope").withDuration(Duration.ofMillis(250));

        assertThat(result.getDuration()).isEqualTo(Duration.ofMillis(250));
    }
}
