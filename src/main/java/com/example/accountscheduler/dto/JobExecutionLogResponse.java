package com.example.accountscheduler.dto;

import com.example.accountscheduler.domain.enums.ErrorKind;
import com.example.accountscheduler.domain.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for one execution attempt
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobExecutionLogResponse {

    private UUID id;
    private UUID jobId;
    private Integer attemptNumber;
    private JobStatus status;
    private String workerId;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private Boolean success;
    private ErrorKind errorKind;
    private String errorMessage;
}
