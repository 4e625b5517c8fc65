package com.example.accountscheduler.cli;

import com.example.accountscheduler.domain.enums.JobStatus;
import com.example.accountscheduler.domain.enums.Platform;
import com.example.accountscheduler.dto.EnqueueJobRequest;
import com.example.accountscheduler.dto.JobResponse;
import com.example.accountscheduler.dto.QueueReport;
import com.example.accountscheduler.exception.InvalidJobStateException;
import com.example.accountscheduler.exception.JobValidationException;
import com.example.accountscheduler.service.JobManagementService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SchedulerCommands Tests")
class SchedulerCommandsTest {

    private static final Instant NOW = Instant.parse("2026-01-05T04:52:00Z");

    @Mock
    private JobManagementService jobManagementService;

    @InjectMocks
    private SchedulerCommands commands;

    @Captor
    private ArgumentCaptor<EnqueueJobRequest> requestCaptor;

    @Nested
    @DisplayName("schedule")
    class ScheduleTests {

        @Test
        @DisplayName("Should enqueue with the given options and print the UTC due time")
        void shouldSchedule() {
            // Given
            var id = UUID.randomUUID();
            when(jobManagementService.enqueue(any())).thenReturn(JobResponse.builder()
                    .id(id)
                    .platform(Platform.TIKTOK)
                    .accountId("acc-1")
                    .scheduledAt(Instant.parse("2026-01-05T04:52:00Z"))
                    .build());

            // When
            var result = commands.run("schedule", Map.of(
                    "platform", "tiktok",
                    "account", "acc-1",
                    "content", "pack-42",
                    "at", "2026-01-05 04:52",
                    "max-retries", "5",
                    "proxy", "px-1"));

            // Then
            assertThat(result.getExitCode()).isEqualTo(CommandResult.OK);
            assertThat(result.getOutput()).contains(id.toString()).contains("2026-01-05 04:52:00 UTC");
            verify(jobManagementService).enqueue(requestCaptor.capture());
            var request = requestCaptor.getValue();
            assertThat(request.getPlatform()).isEqualTo(Platform.TIKTOK);
            assertThat(request.getScheduledAt()).isEqualTo("2026-01-05 04:52");
            assertThat(request.getMaxRetries()).isEqualTo(5);
            assertThat(request.getProxyId()).isEqualTo("px-1");
        }

        @Test
        @DisplayName("Past time should exit 1 with the service's message")
        void pastTimeShouldBeRejected() {
            when(jobManagementService.enqueue(any())).thenThrow(new JobValidationException("scheduledAt",
                    "Scheduled time 2026-01-05 04:00:00 UTC is not in the future (current time: 2026-01-05 04:52:00 UTC)"));

            var result = commands.run("schedule", Map.of(
                    "platform", "TIKTOK", "account", "acc-1", "content", "pack-42", "at", "2026-01-05 04:00"));

            assertThat(result.getExitCode()).isEqualTo(CommandResult.REJECTED);
            assertThat(result.getOutput()).contains("current time: 2026-01-05 04:52:00 UTC");
        }

        @Test
        @DisplayName("Missing options should exit 2 with usage")
        void missingOptionsShouldPrintUsage() {
            var result = commands.run("schedule", Map.of("platform", "TIKTOK"));

            assertThat(result.getExitCode()).isEqualTo(CommandResult.USAGE);
            assertThat(result.getOutput()).contains("Usage:");
            verifyNoInteractions(jobManagementService);
        }

        @Test
        @DisplayName("Unknown platform should exit 2")
        void unknownPlatformShouldBeUsageError() {
            var result = commands.run("schedule", Map.of(
                    "platform", "myspace", "account", "acc-1", "content", "pack-42", "at", "2026-01-05 04:52"));

            assertThat(result.getExitCode()).isEqualTo(CommandResult.USAGE);
            assertThat(result.getOutput()).contains("Unknown platform");
        }
    }

    @Test
    @DisplayName("status should print counts, leased accounts and the filtered list")
    void statusShouldPrintReport() {
        // Given
        var counts = new LinkedHashMap<String, Long>();
        counts.put("QUEUED", 4L);
        counts.put("FAILED", 1L);
        var failed = JobResponse.builder()
                .id(UUID.randomUUID())
                .platform(Platform.INSTAGRAM_REELS)
                .accountId("acc-9")
                .scheduledAt(NOW)
                .retryCount(3)
                .maxRetries(3)
                .lastErrorMessage("proxy unreachable")
                .build();
        when(jobManagementService.report()).thenReturn(QueueReport.builder()
                .statusDistribution(counts)
                .queueDepth(2)
                .leasedAccounts(List.of("acc-1", "acc-2"))
                .retriesExhausted(List.of(failed))
                .permanentFailures(List.of())
                .generatedAt(NOW)
                .build());
        when(jobManagementService.listJobs(eq(JobStatus.FAILED), any())).thenReturn(new PageImpl<>(List.of(failed)));

        // When
        var result = commands.run("status", Map.of("status", "failed"));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutput())
                .contains("QUEUED")
                .contains("Due now: 2")
                .contains("Leased accounts: acc-1, acc-2")
                .contains("Retries exhausted: 1")
                .contains("retries=3/3")
                .contains("proxy unreachable")
                .contains("FAILED jobs: 1");
    }

    @Nested
    @DisplayName("cancel")
    class CancelTests {

        @Test
        @DisplayName("Should cancel by id")
        void shouldCancel() {
            var id = UUID.randomUUID();
            when(jobManagementService.cancel(id)).thenReturn(JobResponse.builder().id(id).status(JobStatus.CANCELLED).build());

            var result = commands.run("cancel", Map.of("job", id.toString()));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getOutput()).isEqualTo("Cancelled job " + id);
        }

        @Test
        @DisplayName("Invalid state should exit 1")
        void invalidStateShouldBeRejected() {
            var id = UUID.randomUUID();
            when(jobManagementService.cancel(id)).thenThrow(new InvalidJobStateException(id.toString(), "RUNNING", "CANCELLED"));

            var result = commands.run("cancel", Map.of("job", id.toString()));

            assertThat(result.getExitCode()).isEqualTo(CommandResult.REJECTED);
        }

        @Test
        @DisplayName("Malformed id should exit 2")
        void malformedIdShouldBeUsageError() {
            assertThat(commands.run("cancel", Map.of("job", "42")).getExitCode()).isEqualTo(CommandResult.USAGE);
        }
    }

    @Test
    @DisplayName("Unknown command should exit 2")
    void unknownCommandShouldBeUsageError() {
        assertThat(commands.run("pause", Map.of()).getExitCode()).isEqualTo(CommandResult.USAGE);
    }

    @Test
    @DisplayName("Command detection should look at the first non-option argument")
    void commandDetection() {
        assertThat(SchedulerCommandRunner.isCommand(new String[]{"status"})).isTrue();
        assertThat(SchedulerCommandRunner.isCommand(new String[]{"--spring.profiles.active=prod", "cancel", "--job=x"})).isTrue();
        assertThat(SchedulerCommandRunner.isCommand(new String[]{"--server.port=8081"})).isFalse();
        assertThat(SchedulerCommandRunner.isCommand(new String[]{})).isFalse();
        assertThat(SchedulerCommandRunner.isCommand(null)).isFalse();
    }
}
