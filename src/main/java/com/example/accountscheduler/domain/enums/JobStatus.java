package com.example.accountscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Job lifecycle states.
 * <p>
 * QUEUED/RETRYING -> RUNNING -> DONE | RETRYING | FAILED | QUEUED, and QUEUED -> CANCELLED.
 */
@Getter
@RequiredArgsConstructor
public enum JobStatus {

    /**
     * Waiting for its scheduled time. Initial state for all new jobs.
     */
    QUEUED("queued", "Queued", true),

    /**
     * Claimed by a worker that holds the account lease.
     */
    RUNNING("running", "Running", false),

    /**
     * Failed transiently and waiting for its backoff to elapse.
     */
    RETRYING("retrying", "Retrying", true),

    /**
     * Completed successfully. Terminal.
     */
    DONE("done", "Done", false),

    /**
     * Permanently failed or out of retries. Terminal.
     */
    FAILED("failed", "Failed", false),

    /**
     * Cancelled by an operator before it ran. Terminal.
     */
    CANCELLED("cancelled", "Cancelled", false);

    private final String code;
    private final String displayName;

    /**
     * Whether a job in this status may be claimed once due
     */
    private final boolean claimable;

    public static JobStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equalsIgnoreCase(code) || status.name().equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + code);
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }

    /**
     * Whether the state machine allows moving from this status to {@code target}
     */
    public boolean canTransitionTo(JobStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<JobStatus> allowedTargets() {
        return switch (this) {
            case QUEUED -> EnumSet.of(RUNNING, CANCELLED);
            case RETRYING -> EnumSet.of(RUNNING);
            case RUNNING -> EnumSet.of(DONE, RETRYING, FAILED, QUEUED);
            case DONE, FAILED, CANCELLED -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
