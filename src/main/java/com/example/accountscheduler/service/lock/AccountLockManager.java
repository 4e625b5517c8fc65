package com.example.accountscheduler.service.lock;

import com.example.accountscheduler.domain.entity.AccountLock;
import com.example.accountscheduler.domain.repository.AccountLockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Time-bounded, renewable leases keyed by account id.
 * <p>
 * A lease is live while {@code now < expiresAt}. Acquisition is a single compare-and-insert
 * statement: it succeeds when no row exists or the existing row has expired, so a crashed
 * holder's account frees up on its own once the ttl passes.
 * <p>
 * Methods join the caller's transaction when there is one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountLockManager {

    private final AccountLockRepository lockRepository;

    @Transactional
    public boolean acquire(String accountId, String ownerId, Duration ttl, Instant now) {
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Lease ttl must be positive: " + ttl);
        }
        var acquired = lockRepository.tryAcquire(accountId, ownerId, now, ttl.toMillis(), now.plus(ttl)) == 1;
        if (acquired) {
            log.debug("Lease on account {} acquired by {} until {}", accountId, ownerId, now.plus(ttl));
        } else {
            log.debug("Lease on account {} is held by another owner", accountId);
        }
        return acquired;
    }

    /**
     * Extend a live lease by its original ttl. Fails if the lease expired or belongs to someone else.
     */
    @Transactional
    public boolean renew(String accountId, String ownerId, Instant now) {
        var renewed = lockRepository.renew(accountId, ownerId, now) == 1;
        if (!renewed) {
            log.warn("Lease renewal for account {} by {} refused (expired or not owner)", accountId, ownerId);
        }
        return renewed;
    }

    /**
     * Release a lease held by {@code ownerId}. Releasing a lease owned by someone else is a no-op.
     */
    @Transactional
    public void release(String accountId, String ownerId) {
        var released = lockRepository.release(accountId, ownerId);
        if (released == 0) {
            log.debug("No lease on account {} held by {} to release", accountId, ownerId);
        }
    }

    @Transactional(readOnly = true)
    public List<AccountLock> liveLeases(Instant now) {
        return lockRepository.findLive(now);
    }

    /**
     * Drop inert rows; returns how many were removed
     */
    @Transactional
    public int purgeExpired(Instant now) {
        return lockRepository.deleteExpired(now);
    }
}
