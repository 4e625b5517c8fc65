package com.example.accountscheduler.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Cluster-singleton periodic maintenance.
 * <p>
 * ShedLock makes sure only one instance runs each job at a time; job claiming itself
 * is never guarded this way.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "account-scheduler.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class HousekeepingService {

    private final JobManagementService jobManagementService;

    @Scheduled(fixedDelayString = "${account-scheduler.housekeeping.retention-interval-ms:3600000}")
    @SchedulerLock(name = "jobRetentionCleanup", lockAtLeastFor = "30s", lockAtMostFor = "10m")
    public void cleanupOldJobs() {
        try {
            var deleted = jobManagementService.cleanupOldJobs();
            if (deleted == 0) {
                log.debug("No terminal jobs past retention");
            }
        } catch (Exception e) {
            log.error("Error cleaning up old jobs: {}", e.getMessage(), e);
        }
    }
}
