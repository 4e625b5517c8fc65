package com.example.accountscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed action window for one (account, platform) pair, anchored at the first action.
 */
@Entity
@Table(name = "rate_windows")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RateWindow {

    @EmbeddedId
    private RateWindowId id;

    @Column(name = "window_start", nullable = false)
    private Instant windowStart;

    @Column(name = "action_count", nullable = false)
    private Integer actionCount;

    @Column(name = "action_limit", nullable = false)
    private Integer actionLimit;

    public Instant resetAt(Duration window) {
        return windowStart.plus(window);
    }

    public boolean isElapsed(Instant now, Duration window) {
        return !now.isBefore(resetAt(window));
    }
}
