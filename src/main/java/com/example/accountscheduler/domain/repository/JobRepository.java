package com.example.accountscheduler.domain.repository;

import com.example.accountscheduler.domain.entity.Job;
import com.example.accountscheduler.domain.enums.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Job entity.
 * <p>
 * Uses PostgreSQL-specific features for claiming:
 * - FOR UPDATE SKIP LOCKED so concurrent claimers never block on each other's candidates
 * - NOT EXISTS against account_locks so leased accounts are filtered in the same statement
 */
@Repository
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Earliest due claimable job of each account that has no live lease, earliest due first,
     * ties by creation. One row per account, so a backlog on one account never crowds the
     * others out of the batch. Rows are locked for the surrounding transaction; rows locked by
     * another claimer are skipped.
     */
    @Query(value = """
            SELECT j.* FROM jobs j
            WHERE j.id IN (
                SELECT DISTINCT ON (c.account_id) c.id FROM jobs c
                WHERE c.status IN ('QUEUED', 'RETRYING')
                  AND c.scheduled_at <= :now
                  AND NOT EXISTS (
                      SELECT 1 FROM account_locks l
                      WHERE l.account_id = c.account_id
                        AND l.expires_at > :now
                  )
                ORDER BY c.account_id, c.scheduled_at ASC, c.created_at ASC
            )
              AND j.status IN ('QUEUED', 'RETRYING')
              AND j.scheduled_at <= :now
            ORDER BY j.scheduled_at ASC, j.created_at ASC
            LIMIT :limit
            FOR UPDATE OF j SKIP LOCKED
            """, nativeQuery = true)
    List<Job> findClaimCandidates(@Param("now") Instant now, @Param("limit") int limit);

    /**
     * Push every claimable job of an account on a platform that would come due before
     * {@code resetAt} to {@code resetAt}. Status and retry count are left alone. Rows locked by
     * another claimer are skipped; that claimer defers them itself.
     *
     * @return number of jobs deferred
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
            UPDATE jobs
            SET scheduled_at = :resetAt,
                updated_at = :now
            WHERE id IN (
                SELECT c.id FROM jobs c
                WHERE c.account_id = :accountId
                  AND c.platform = :platform
                  AND c.status IN ('QUEUED', 'RETRYING')
                  AND c.scheduled_at < :resetAt
                FOR UPDATE SKIP LOCKED
            )
            """, nativeQuery = true)
    int deferAccountJobs(@Param("accountId") String accountId,
                         @Param("platform") String platform,
                         @Param("resetAt") Instant resetAt,
                         @Param("now") Instant now);

    /**
     * Returns RUNNING jobs to QUEUED once their claim expired and the claimer no longer
     * holds a live lease on the account (a renewed lease keeps the job running).
     *
     * @return number of jobs reclaimed
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            UPDATE jobs j
            SET status = 'QUEUED',
                claimed_by = NULL,
                claimed_at = NULL,
                claim_expires_at = NULL,
                updated_at = :now
            WHERE j.status = 'RUNNING'
              AND j.claim_expires_at <= :now
              AND NOT EXISTS (
                  SELECT 1 FROM account_locks l
                  WHERE l.account_id = j.account_id
                    AND l.owner_id = j.claimed_by
                    AND l.expires_at > :now
              )
            """, nativeQuery = true)
    int reclaimExpiredClaims(@Param("now") Instant now);

    /**
     * Load a job and hold its row lock until the transaction ends
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Compare-and-set cancellation; only a QUEUED job can be cancelled
     *
     * @return 1 if cancelled, 0 if the job was not QUEUED
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.status = com.example.accountscheduler.domain.enums.JobStatus.CANCELLED,
                j.completedAt = :now,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.example.accountscheduler.domain.enums.JobStatus.QUEUED
            """)
    int cancelIfQueued(@Param("id") UUID id, @Param("now") Instant now);

    long countByStatus(JobStatus status);

    Page<Job> findByStatus(JobStatus status, Pageable pageable);

    /**
     * Claimable jobs already due
     */
    @Query("""
            SELECT COUNT(j) FROM Job j
            WHERE j.status IN (com.example.accountscheduler.domain.enums.JobStatus.QUEUED,
                               com.example.accountscheduler.domain.enums.JobStatus.RETRYING)
              AND j.scheduledAt <= :now
            """)
    long countDue(@Param("now") Instant now);

    /**
     * Failed jobs that used up their whole retry budget
     */
    @Query("""
            SELECT j FROM Job j
            WHERE j.status = com.example.accountscheduler.domain.enums.JobStatus.FAILED
              AND j.retryCount >= j.maxRetries
              AND j.lastError.kind = com.example.accountscheduler.domain.enums.ErrorKind.TRANSIENT
            ORDER BY j.updatedAt DESC
            """)
    List<Job> findRetriesExhausted(Pageable pageable);

    /**
     * Jobs failed by a permanent error, independent of their retry count
     */
    @Query("""
            SELECT j FROM Job j
            WHERE j.status = com.example.accountscheduler.domain.enums.JobStatus.FAILED
              AND j.lastError.kind = com.example.accountscheduler.domain.enums.ErrorKind.PERMANENT
            ORDER BY j.updatedAt DESC
            """)
    List<Job> findPermanentFailures(Pageable pageable);

    @Query("""
            SELECT j.status as status, COUNT(j) as count
            FROM Job j
            GROUP BY j.status
            """)
    List<Object[]> getJobStatsByStatus();

    @Query("""
            SELECT j.id FROM Job j
            WHERE j.status IN (com.example.accountscheduler.domain.enums.JobStatus.DONE,
                               com.example.accountscheduler.domain.enums.JobStatus.FAILED,
                               com.example.accountscheduler.domain.enums.JobStatus.CANCELLED)
              AND j.completedAt < :cutoff
            """)
    List<UUID> findTerminalIdsCompletedBefore(@Param("cutoff") Instant cutoff);

    @Modifying
    @Query("DELETE FROM Job j WHERE j.id IN :ids")
    int deleteByIds(@Param("ids") List<UUID> ids);
}
