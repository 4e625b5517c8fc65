package com.example.accountscheduler.exception;

import com.example.accountscheduler.domain.enums.ErrorKind;

public class TransientExecutionException extends JobExecutionException {

    public TransientExecutionException(String message) {
        super(ErrorKind.TRANSIENT, message);
    }

    public TransientExecutionException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT, message, cause);
    }
}
