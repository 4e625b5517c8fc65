package com.example.accountscheduler.cli;

import com.example.accountscheduler.domain.enums.JobStatus;
import com.example.accountscheduler.domain.enums.Platform;
import com.example.accountscheduler.dto.EnqueueJobRequest;
import com.example.accountscheduler.dto.JobResponse;
import com.example.accountscheduler.exception.InvalidJobStateException;
import com.example.accountscheduler.exception.JobNotFoundException;
import com.example.accountscheduler.exception.JobValidationException;
import com.example.accountscheduler.service.JobManagementService;
import com.example.accountscheduler.time.UtcTimestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Operator commands: {@code schedule}, {@code status} and {@code cancel}.
 * <p>
 * Exit codes: 0 success, 1 rejected (validation error, unknown job, invalid state), 2 usage error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulerCommands {

    static final String USAGE = """
            Usage:
              schedule --platform=<TIKTOK|INSTAGRAM_REELS|YOUTUBE_SHORTS> --account=<id> --content=<ref> --at="YYYY-MM-DD HH:MM" [--max-retries=<n>] [--proxy=<id>]
              status [--status=<QUEUED|RUNNING|RETRYING|DONE|FAILED|CANCELLED>]
              cancel --job=<uuid>
            All times are UTC.""";

    static final int STATUS_LIST_LIMIT = 100;

    private final JobManagementService jobManagementService;

    public CommandResult run(String command, Map<String, String> options) {
        if (command == null) {
            return CommandResult.usage("No command given");
        }
        log.info("CLI: {} {}", command, options.keySet());
        try {
            return switch (command) {
                case "schedule" -> schedule(options);
                case "status" -> status(options);
                case "cancel" -> cancel(options);
                default -> CommandResult.usage("Unknown command: " + command);
            };
        } catch (JobValidationException e) {
            return CommandResult.rejected("Rejected (" + e.getField() + "): " + e.getMessage());
        } catch (JobNotFoundException | InvalidJobStateException e) {
            return CommandResult.rejected(e.getMessage());
        }
    }

    private CommandResult schedule(Map<String, String> options) {
        var platform = required(options, "platform");
        var account = required(options, "account");
        var content = required(options, "content");
        var at = required(options, "at");
        if (platform == null || account == null || content == null || at == null) {
            return CommandResult.usage("schedule requires --platform, --account, --content and --at");
        }

        Platform parsedPlatform;
        Integer maxRetries = null;
        try {
            parsedPlatform = Platform.fromCode(platform);
            if (options.containsKey("max-retries")) {
                maxRetries = Integer.valueOf(options.get("max-retries"));
            }
        } catch (IllegalArgumentException e) {
            return CommandResult.usage(e.getMessage());
        }

        var job = jobManagementService.enqueue(EnqueueJobRequest.builder()
                .platform(parsedPlatform)
                .accountId(account)
                .contentRef(content)
                .scheduledAt(at)
                .maxRetries(maxRetries)
                .proxyId(options.get("proxy"))
                .build());

        return CommandResult.ok(String.format("Scheduled job %s (%s / %s) for %s",
                job.getId(), job.getPlatform(), job.getAccountId(), UtcTimestamps.format(job.getScheduledAt())));
    }

    private CommandResult status(Map<String, String> options) {
        JobStatus filter = null;
        if (options.containsKey("status")) {
            try {
                filter = JobStatus.fromCode(options.get("status"));
            } catch (IllegalArgumentException e) {
                return CommandResult.usage(e.getMessage());
            }
        }

        var report = jobManagementService.report();
        var out = new StringBuilder();
        out.append("Queue report at ").append(UtcTimestamps.format(report.getGeneratedAt())).append('\n');
        report.getStatusDistribution().forEach((status, count) ->
                out.append(String.format("  %-10s %d%n", status, count)));
        out.append("Due now: ").append(report.getQueueDepth()).append('\n');
        out.append("Leased accounts: ")
                .append(report.getLeasedAccounts().isEmpty() ? "none" : String.join(", ", report.getLeasedAccounts()))
                .append('\n');
        appendJobs(out, "Retries exhausted", report.getRetriesExhausted());
        appendJobs(out, "Permanent failures", report.getPermanentFailures());

        if (filter != null) {
            var page = jobManagementService.listJobs(filter,
                    PageRequest.of(0, STATUS_LIST_LIMIT, Sort.by(Sort.Direction.ASC, "scheduledAt")));
            appendJobs(out, filter.name() + " jobs", page.getContent());
        }
        return CommandResult.ok(out.toString().stripTrailing());
    }

    private CommandResult cancel(Map<String, String> options) {
        var jobId = required(options, "job");
        if (jobId == null) {
            return CommandResult.usage("cancel requires --job");
        }

        UUID id;
        try {
            id = UUID.fromString(jobId);
        } catch (IllegalArgumentException e) {
            return CommandResult.usage("Not a job id: " + jobId);
        }

        var job = jobManagementService.cancel(id);
        return CommandResult.ok("Cancelled job " + job.getId());
    }

    private static void appendJobs(StringBuilder out, String title, List<JobResponse> jobs) {
        out.append(title).append(": ").append(jobs.size()).append('\n');
        for (var job : jobs) {
            out.append(String.format("  %s %-15s %-20s %s retries=%d/%d%s%n",
                    job.getId(), job.getPlatform(), job.getAccountId(), UtcTimestamps.format(job.getScheduledAt()),
                    job.getRetryCount(), job.getMaxRetries(),
                    job.getLastErrorMessage() != null ? " last error: " + job.getLastErrorMessage() : ""));
        }
    }

    private static String required(Map<String, String> options, String name) {
        var value = options.get(name);
        return value == null || value.isBlank() ? null : value;
    }
}
