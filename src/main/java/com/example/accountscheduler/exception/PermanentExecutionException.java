package com.example.accountscheduler.exception;

import com.example.accountscheduler.domain.enums.ErrorKind;

public class PermanentExecutionException extends JobExecutionException {

    public PermanentExecutionException(String message) {
        super(ErrorKind.PERMANENT, message);
    }

    public PermanentExecutionException(String message, Throwable cause) {
        super(ErrorKind.PERMANENT, message, cause);
    }
}
