package com.example.accountscheduler.exception;

import com.example.accountscheduler.domain.enums.ErrorKind;
import lombok.Getter;

import java.time.Duration;

/**
 * The platform refused the action because of rate limits
 */
@Getter
public class RateLimitedException extends JobExecutionException {

    /**
     * Platform-suggested wait, null when unknown
     */
    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter) {
        super(ErrorKind.RATE_LIMITED, message);
        this.retryAfter = retryAfter;
    }
}
