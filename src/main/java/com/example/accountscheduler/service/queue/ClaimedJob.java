package com.example.accountscheduler.service.queue;

import com.example.accountscheduler.domain.entity.Job;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * A job handed to a worker together with the lease that protects its account.
 */
@Getter
@AllArgsConstructor
public class ClaimedJob {

    private final Job job;
    private final String ownerId;
    private final Instant leaseExpiresAt;
}
