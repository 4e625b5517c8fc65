package com.example.accountscheduler.dto;

import com.example.accountscheduler.domain.enums.Platform;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for enqueueing a job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnqueueJobRequest {

    @NotNull(message = "Platform is required")
    private Platform platform;

    @NotBlank(message = "Account ID is required")
    @Size(max = 100)
    private String accountId;

    @NotBlank(message = "Content reference is required")
    @Size(max = 500)
    private String contentRef;

    /**
     * {@code YYYY-MM-DD HH:MM} (UTC) or ISO-8601 with an explicit offset
     */
    @NotBlank(message = "Scheduled time is required")
    private String scheduledAt;

    /**
     * Override default max retries
     */
    @Min(0)
    private Integer maxRetries;

    /**
     * Pin a proxy instead of using the account's binding
     */
    @Size(max = 100)
    private String proxyId;

    /**
     * Executor hints
     */
    private Map<String, Object> metadata;
}
