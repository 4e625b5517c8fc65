package com.example.accountscheduler.controller;

import com.example.accountscheduler.domain.enums.JobStatus;
import com.example.accountscheduler.dto.ApiResponse;
import com.example.accountscheduler.dto.EnqueueJobRequest;
import com.example.accountscheduler.dto.JobResponse;
import com.example.accountscheduler.dto.QueueReport;
import com.example.accountscheduler.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST API controller for scheduled jobs.
 * <p>
 * Provides endpoints for:
 * - Enqueueing jobs
 * - Listing and inspecting jobs with their attempt history
 * - Cancelling queued jobs
 * - The queue report
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/jobs")
@Tag(name = "Jobs", description = "APIs for scheduling per-account automation jobs")
public class JobController {

    private final JobManagementService jobManagementService;

    @PostMapping
    @Operation(summary = "Enqueue a job", description = "Schedule a job for an account; the time is interpreted as UTC")
    public ResponseEntity<ApiResponse<JobResponse>> enqueue(@Valid @RequestBody EnqueueJobRequest request) {
        log.info("API: Enqueue {} job for account {} at {}", request.getPlatform(), request.getAccountId(),
                request.getScheduledAt());

        var response = jobManagementService.enqueue(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Job enqueued successfully"));
    }

    @GetMapping
    @Operation(summary = "List jobs", description = "List jobs, optionally filtered by status")
    public ResponseEntity<ApiResponse<Page<JobResponse>>> listJobs(
            @Parameter(description = "Status filter") @RequestParam(required = false) JobStatus status,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        var pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.ASC, "scheduledAt"));
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.listJobs(status, pageable)));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job by ID", description = "Retrieve a job together with its attempt history")
    public ResponseEntity<ApiResponse<JobResponse>> getJob(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getJobWithHistory(jobId)));
    }

    @PostMapping("/{jobId}/cancel")
    @Operation(summary = "Cancel a job", description = "Cancel a job that is still queued")
    public ResponseEntity<ApiResponse<JobResponse>> cancel(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        log.info("API: Cancel job {}", jobId);

        var response = jobManagementService.cancel(jobId);
        return ResponseEntity.ok(ApiResponse.success(response, "Job cancelled successfully"));
    }

    @GetMapping("/report")
    @Operation(summary = "Queue report", description = "Status counts, queue depth, leased accounts and failures needing attention")
    public ResponseEntity<ApiResponse<QueueReport>> report() {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.report()));
    }
}
