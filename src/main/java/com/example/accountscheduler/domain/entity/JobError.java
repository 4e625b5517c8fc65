package com.example.accountscheduler.domain.entity;

import com.example.accountscheduler.domain.enums.ErrorKind;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Structured last error of a job: what kind of failure, what was reported, and when.
 */
@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobError {

    public static final int MAX_MESSAGE_LENGTH = 2000;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_error_kind", length = 20)
    private ErrorKind kind;

    @Column(name = "last_error_message", columnDefinition = "TEXT")
    private String message;

    @Column(name = "last_error_at")
    private Instant occurredAt;

    public static JobError of(ErrorKind kind, String message, Instant occurredAt) {
        var trimmed = message != null && message.length() > MAX_MESSAGE_LENGTH
                ? message.substring(0, MAX_MESSAGE_LENGTH)
                : message;
        return new JobError(kind, trimmed, occurredAt);
    }
}
