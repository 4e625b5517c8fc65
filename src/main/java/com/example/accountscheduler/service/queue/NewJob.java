package com.example.accountscheduler.service.queue;

import com.example.accountscheduler.domain.enums.Platform;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A validated-shape request to put a job on the queue; the queue checks the values.
 */
@Value
@Builder
public class NewJob {
    Platform platform;
    String accountId;
    String contentRef;
    Instant scheduledAt;
    Integer maxRetries;
    String proxyId;
    Map<String, Object> metadata;
}
