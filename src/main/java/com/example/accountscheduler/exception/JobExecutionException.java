package com.example.accountscheduler.exception;

import com.example.accountscheduler.domain.enums.ErrorKind;
import lombok.Getter;

/**
 * Failure signalled by an executor, carrying its classification
 */
@Getter
public abstract class JobExecutionException extends RuntimeException {

    private final ErrorKind kind;

    protected JobExecutionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected JobExecutionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
