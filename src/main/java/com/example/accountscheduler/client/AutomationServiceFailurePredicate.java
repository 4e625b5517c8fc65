package com.example.accountscheduler.client;

import com.example.accountscheduler.exception.ExternalServiceException;

import java.util.function.Predicate;

/**
 * Decides which automation service failures count toward the circuit breaker.
 * <p>
 * The breaker is shared by every account, so only failures of the service itself are
 * recorded: transport errors, timeouts and retryable HTTP statuses. A 429 or a non-retryable
 * 4xx concerns a single account (throttled, bad credentials, rejected content) and is ignored.
 */
public class AutomationServiceFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof ExternalServiceException e) {
            return e.isRetryable() && !e.isRateLimited();
        }
        return true;
    }
}
