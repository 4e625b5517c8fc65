package com.example.accountscheduler.dto;

import com.example.accountscheduler.domain.enums.ErrorKind;
import com.example.accountscheduler.domain.enums.JobStatus;
import com.example.accountscheduler.domain.enums.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for job data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private UUID id;
    private Platform platform;
    private String accountId;
    private String proxyId;
    private String contentRef;
    private Instant scheduledAt;
    private JobStatus status;
    private Integer retryCount;
    private Integer maxRetries;
    private ErrorKind lastErrorKind;
    private String lastErrorMessage;
    private Instant lastErrorAt;
    private Map<String, Object> metadata;
    private String claimedBy;
    private Instant claimExpiresAt;
    private Instant completedAt;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Attempt history (populated on detail requests)
     */
    private List<JobExecutionLogResponse> executionHistory;
}
