package com.example.accountscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Operator view of the queue: where jobs are, which accounts are busy, and what needs attention
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueReport {

    private Map<String, Long> statusDistribution;

    /**
     * Claimable jobs already due
     */
    private long queueDepth;

    /**
     * Accounts currently holding a live lease
     */
    private List<String> leasedAccounts;

    /**
     * Failed after using up the whole retry budget
     */
    private List<JobResponse> retriesExhausted;

    private List<JobResponse> permanentFailures;

    private Instant generatedAt;
}
