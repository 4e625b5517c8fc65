package com.example.accountscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;

/**
 * Time-bounded lease on an account. At most one row per account; a row whose
 * {@code expiresAt} has passed is inert and may be taken over by anyone.
 */
@Entity
@Table(name = "account_locks")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountLock {

    @Id
    @Column(name = "account_id", length = 100)
    private String accountId;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "ttl_ms", nullable = false)
    private Long ttlMs;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public Duration getTtl() {
        return Duration.ofMillis(ttlMs);
    }

    public boolean isLive(Instant now) {
        return now.isBefore(expiresAt);
    }
}
