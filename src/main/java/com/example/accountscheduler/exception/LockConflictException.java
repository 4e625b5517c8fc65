package com.example.accountscheduler.exception;

import lombok.Getter;

/**
 * Account lease held by someone else. Only used inside the claim loop, never surfaced to callers.
 */
@Getter
public class LockConflictException extends RuntimeException {

    private final String accountId;

    public LockConflictException(String accountId) {
        super("Account is leased by another worker: " + accountId);
        this.accountId = accountId;
    }
}
