package com.example.accountscheduler.domain.repository;

import com.example.accountscheduler.domain.entity.AccountLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for AccountLock entity.
 * <p>
 * Every mutation is a single conditional statement; callers read the affected row count
 * instead of reading the lease first.
 */
@Repository
public interface AccountLockRepository extends JpaRepository<AccountLock, String> {

    /**
     * Insert a lease, or take over an expired one. A live lease held by anyone is left untouched.
     *
     * @return 1 if the caller now holds the lease, 0 otherwise
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
            INSERT INTO account_locks (account_id, owner_id, acquired_at, ttl_ms, expires_at)
            VALUES (:accountId, :ownerId, :now, :ttlMs, :expiresAt)
            ON CONFLICT (account_id) DO UPDATE
            SET owner_id = EXCLUDED.owner_id,
                acquired_at = EXCLUDED.acquired_at,
                ttl_ms = EXCLUDED.ttl_ms,
                expires_at = EXCLUDED.expires_at
            WHERE account_locks.expires_at <= :now
            """, nativeQuery = true)
    int tryAcquire(@Param("accountId") String accountId,
                   @Param("ownerId") String ownerId,
                   @Param("now") Instant now,
                   @Param("ttlMs") long ttlMs,
                   @Param("expiresAt") Instant expiresAt);

    /**
     * Extend a live lease by its own ttl, counted from {@code now}
     *
     * @return 1 if renewed, 0 on owner mismatch or expiry
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
            UPDATE account_locks
            SET acquired_at = :now,
                expires_at = :now + (ttl_ms * INTERVAL '1 millisecond')
            WHERE account_id = :accountId
              AND owner_id = :ownerId
              AND expires_at > :now
            """, nativeQuery = true)
    int renew(@Param("accountId") String accountId, @Param("ownerId") String ownerId, @Param("now") Instant now);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM AccountLock l WHERE l.accountId = :accountId AND l.ownerId = :ownerId")
    int release(@Param("accountId") String accountId, @Param("ownerId") String ownerId);

    @Query("SELECT l FROM AccountLock l WHERE l.expiresAt > :now ORDER BY l.acquiredAt ASC")
    List<AccountLock> findLive(@Param("now") Instant now);

    @Query("SELECT COUNT(l) FROM AccountLock l WHERE l.expiresAt > :now")
    long countLive(@Param("now") Instant now);

    /**
     * Purge inert rows. Safe at any time: an expired lease grants nothing.
     */
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM AccountLock l WHERE l.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
