package com.example.accountscheduler.domain.enums;

/**
 * Classification of a failed attempt.
 */
public enum ErrorKind {

    /**
     * Worth retrying after a backoff; consumes one retry.
     */
    TRANSIENT,

    /**
     * Retrying cannot help; the job fails immediately.
     */
    PERMANENT,

    /**
     * The platform refused because of rate limits; rescheduled without consuming a retry.
     */
    RATE_LIMITED
}
