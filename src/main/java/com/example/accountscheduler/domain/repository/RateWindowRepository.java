package com.example.accountscheduler.domain.repository;

import com.example.accountscheduler.domain.entity.RateWindow;
import com.example.accountscheduler.domain.entity.RateWindowId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * Repository for RateWindow entity.
 * <p>
 * A window whose {@code window_start <= windowFloor} (i.e. {@code now - window}) has elapsed
 * and is restarted at {@code now}.
 */
@Repository
public interface RateWindowRepository extends JpaRepository<RateWindow, RateWindowId> {

    /**
     * Count one action if the window has room, starting a fresh window when the old one elapsed.
     *
     * @return 1 if the action was counted, 0 if the window is full
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
            INSERT INTO rate_windows (account_id, platform, window_start, action_count, action_limit)
            VALUES (:accountId, :platform, :now, 1, :limit)
            ON CONFLICT (account_id, platform) DO UPDATE
            SET window_start = CASE WHEN rate_windows.window_start <= :windowFloor
                                    THEN :now ELSE rate_windows.window_start END,
                action_count = CASE WHEN rate_windows.window_start <= :windowFloor
                                    THEN 1 ELSE rate_windows.action_count + 1 END,
                action_limit = :limit
            WHERE rate_windows.window_start <= :windowFloor
               OR rate_windows.action_count < :limit
            """, nativeQuery = true)
    int incrementIfAllowed(@Param("accountId") String accountId,
                           @Param("platform") String platform,
                           @Param("now") Instant now,
                           @Param("windowFloor") Instant windowFloor,
                           @Param("limit") int limit);

    /**
     * Fill the current window so nothing else is admitted until it resets
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
            INSERT INTO rate_windows (account_id, platform, window_start, action_count, action_limit)
            VALUES (:accountId, :platform, :now, :limit, :limit)
            ON CONFLICT (account_id, platform) DO UPDATE
            SET window_start = CASE WHEN rate_windows.window_start <= :windowFloor
                                    THEN :now ELSE rate_windows.window_start END,
                action_count = CASE WHEN rate_windows.window_start <= :windowFloor
                                    THEN :limit ELSE GREATEST(rate_windows.action_count, :limit) END,
                action_limit = :limit
            """, nativeQuery = true)
    int saturate(@Param("accountId") String accountId,
                 @Param("platform") String platform,
                 @Param("now") Instant now,
                 @Param("windowFloor") Instant windowFloor,
                 @Param("limit") int limit);
}
