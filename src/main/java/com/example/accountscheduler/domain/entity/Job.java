package com.example.accountscheduler.domain.entity;

import com.example.accountscheduler.domain.enums.JobStatus;
import com.example.accountscheduler.domain.enums.Platform;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One scheduled automation action against one account.
 * <p>
 * Supports:
 * - Per-job retry budget fixed at creation
 * - Structured last error
 * - Executor hints in jsonb metadata
 * - Claim fields for lease-based recovery
 * <p>
 * All timestamps are UTC instants supplied by the injected clock.
 */
@Entity
@Table(name = "jobs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "platform", nullable = false, length = 30)
    private Platform platform;

    @Column(name = "account_id", nullable = false, length = 100)
    private String accountId;

    /**
     * Sticky proxy, bound at enqueue or at dispatch from the account's binding
     */
    @Column(name = "proxy_id", length = 100)
    private String proxyId;

    /**
     * Opaque reference to the content the executor should post
     */
    @Column(name = "content_ref", nullable = false, length = 500)
    private String contentRef;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.QUEUED;

    /**
     * Transient failures consumed so far; never exceeds maxRetries
     */
    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private Integer retryCount = 0;

    @Column(name = "max_retries", nullable = false, updatable = false)
    private Integer maxRetries;

    @Embedded
    private JobError lastError;

    /**
     * Executor hints (caption, hashtags, ...) forwarded as-is
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    // === Claim Fields ===

    @Column(name = "claimed_by", length = 100)
    private String claimedBy;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "claim_expires_at")
    private Instant claimExpiresAt;

    // === Audit Fields ===

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (this.status == null) {
            this.status = JobStatus.QUEUED;
        }
        if (this.retryCount == null) {
            this.retryCount = 0;
        }
        if (this.metadata == null) {
            this.metadata = new HashMap<>();
        }
    }

    // === Helper Methods ===

    /**
     * Whether {@code ownerId} is the worker currently running this job
     */
    public boolean isClaimedBy(String ownerId) {
        return status == JobStatus.RUNNING && ownerId != null && ownerId.equals(claimedBy);
    }

    /**
     * Moves to {@code target}, rejecting transitions the lifecycle does not allow
     */
    public void transitionTo(JobStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(String.format("Job %s cannot move from %s to %s", id, status, target));
        }
        this.status = target;
        this.updatedAt = now;
        if (target != JobStatus.RUNNING) {
            clearClaim();
        }
        if (target.isTerminal()) {
            this.completedAt = now;
        }
    }

    public void claim(String ownerId, Instant now, Instant expiresAt) {
        transitionTo(JobStatus.RUNNING, now);
        this.claimedBy = ownerId;
        this.claimedAt = now;
        this.claimExpiresAt = expiresAt;
    }

    public void clearClaim() {
        this.claimedBy = null;
        this.claimedAt = null;
        this.claimExpiresAt = null;
    }
}
