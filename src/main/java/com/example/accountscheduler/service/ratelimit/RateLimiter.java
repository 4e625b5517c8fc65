package com.example.accountscheduler.service.ratelimit;

import com.example.accountscheduler.config.SchedulerProperties;
import com.example.accountscheduler.domain.entity.RateWindowId;
import com.example.accountscheduler.domain.enums.Platform;
import com.example.accountscheduler.domain.repository.RateWindowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Fixed-window action counters per (account, platform).
 * <p>
 * A window opens with the first action and lasts {@code rate-window}. Within it at most
 * {@code rate-limit-per-hour.<PLATFORM>} actions are admitted; the check and the increment
 * are one statement, so concurrent callers cannot overshoot the limit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimiter {

    private final RateWindowRepository rateWindowRepository;
    private final SchedulerProperties properties;

    /**
     * Count one action if the window has room.
     *
     * @return true if the action may proceed
     */
    @Transactional
    public boolean checkAndIncrement(String accountId, Platform platform, Instant now) {
        var limit = properties.rateLimitFor(platform);
        var allowed = rateWindowRepository.incrementIfAllowed(accountId, platform.name(), now, windowFloor(now), limit) == 1;
        if (!allowed) {
            log.debug("Rate window full for account {} on {} (limit {})", accountId, platform, limit);
        }
        return allowed;
    }

    /**
     * When the current window of the account ends; {@code now} if it has no open window
     */
    @Transactional(readOnly = true)
    public Instant windowResetAt(String accountId, Platform platform, Instant now) {
        var window = properties.getRateWindow();
        return rateWindowRepository.findById(new RateWindowId(accountId, platform))
                .filter(rw -> !rw.isElapsed(now, window))
                .map(rw -> rw.resetAt(window))
                .orElse(now);
    }

    /**
     * Close the current window after the platform itself reported a rate limit
     *
     * @return when the window resets
     */
    @Transactional
    public Instant markExhausted(String accountId, Platform platform, Instant now) {
        rateWindowRepository.saturate(accountId, platform.name(), now, windowFloor(now), properties.rateLimitFor(platform));
        var resetAt = windowResetAt(accountId, platform, now);
        log.info("Rate window for account {} on {} marked exhausted until {}", accountId, platform, resetAt);
        return resetAt;
    }

    private Instant windowFloor(Instant now) {
        return now.minus(properties.getRateWindow());
    }
}
