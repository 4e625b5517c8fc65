package com.example.accountscheduler.exception;

import lombok.Getter;

/**
 * Rejected job request. Raised before anything is persisted.
 */
@Getter
public class JobValidationException extends RuntimeException {

    private final String field;

    public JobValidationException(String field, String message) {
        super(message);
        this.field = field;
    }
}
