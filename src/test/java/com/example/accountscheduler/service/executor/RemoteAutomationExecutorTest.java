package com.example.accountscheduler.service.executor;

import com.example.accountscheduler.client.AutomationServiceClient;
import com.example.accountscheduler.client.ClientModels.AutomationRequest;
import com.example.accountscheduler.client.ClientModels.AutomationResponse;
import com.example.accountscheduler.domain.entity.Job;
import com.example.accountscheduler.domain.enums.ErrorKind;
import com.example.accountscheduler.domain.enums.JobStatus;
import com.example.accountscheduler.domain.enums.Platform;
import com.example.accountscheduler.exception.ExternalServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RemoteAutomationExecutor Tests")
class RemoteAutomationExecutorTest {

    @Mock
    private AutomationServiceClient client;

    @Captor
    private ArgumentCaptor<AutomationRequest> requestCaptor;

    private RemoteAutomationExecutor executor;
    private Job job;

    @BeforeEach
    void setUp() {
        executor = new RemoteAutomationExecutor(Platform.TIKTOK, client);
        job = Job.builder()
                .id(UUID.randomUUID())
                .platform(Platform.TIKTOK)
                .accountId("acc-1")
                .proxyId("px-7")
                .contentRef("pack-42")
                .scheduledAt(Instant.parse("2026-01-05T04:52:00Z"))
                .status(JobStatus.RUNNING)
                .retryCount(1)
                .maxRetries(3)
                .metadata(new HashMap<>(Map.of("caption", "hello")))
                .build();
    }

    @Test
    @DisplayName("Should send account, proxy, content and attempt number")
    void shouldSendJobDetails() {
        // Given
        when(client.publish(any())).thenReturn(AutomationResponse.builder().outcome("POSTED").externalId("v-1").build());

        // When
        executor.execute(job);

        // Then
        verify(client).publish(requestCaptor.capture());
        var request = requestCaptor.getValue();
        assertThat(request.getJobId()).isEqualTo(job.getId().toString());
        assertThat(request.getPlatform()).isEqualTo("tiktok");
        assertThat(request.getAccountId()).isEqualTo("acc-1");
        assertThat(request.getProxyId()).isEqualTo("px-7");
        assertThat(request.getContentRef()).isEqualTo("pack-42");
        assertThat(request.getAttempt()).isEqualTo(2);
        assertThat(request.getMetadata()).containsEntry("caption", "hello");
    }

    @Nested
    @DisplayName("Outcome mapping")
    class OutcomeTests {

        @Test
        @DisplayName("POSTED is a success")
        void postedIsSuccess() {
            when(client.publish(any())).thenReturn(AutomationResponse.builder().outcome("POSTED").externalId("v-1").build());

            var result = executor.execute(job);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getMessage()).isEqualTo("Posted as v-1");
        }

        @Test
        @DisplayName("REJECTED is permanent")
        void rejectedIsPermanent() {
            when(client.publish(any())).thenReturn(AutomationResponse.builder().outcome("REJECTED").message("account suspended").build());

            var result = executor.execute(job);

            assertThat(result.getErrorKind()).isEqualTo(ErrorKind.PERMANENT);
            assertThat(result.getMessage()).isEqualTo("account suspended");
        }

        @Test
        @DisplayName("RATE_LIMITED carries the suggested wait")
        void rateLimitedCarriesWait() {
            when(client.publish(any())).thenReturn(AutomationResponse.builder()
                    .outcome("RATE_LIMITED").retryAfterSeconds(900L).build());

            var result = executor.execute(job);

            assertThat(result.getErrorKind()).isEqualTo(ErrorKind.RATE_LIMITED);
            assertThat(result.getRetryAfter()).isEqualTo(Duration.ofMinutes(15));
        }

        @Test
        @DisplayName("Unknown outcome and empty response are transient")
        void unknownOutcomeIsTransient() {
            when(client.publish(any())).thenReturn(AutomationResponse.builder().outcome("RETRYABLE_ERROR").message("captcha").build());
            assertThat(executor.execute(job).getErrorKind()).isEqualTo(ErrorKind.TRANSIENT);

            when(client.publish(any())).thenReturn(null);
            assertThat(executor.execute(job).getErrorKind()).isEqualTo(ErrorKind.TRANSIENT);
        }
    }

    @Nested
    @DisplayName("Transport failures")
    class TransportTests {

        @Test
        @DisplayName("HTTP 429 is rate-limited")
        void http429IsRateLimited() {
            when(client.publish(any())).thenThrow(
                    new ExternalServiceException("automation-service", 429, "slow down", Duration.ofSeconds(60)));

            var result = executor.execute(job);

            assertThat(result.getErrorKind()).isEqualTo(ErrorKind.RATE_LIMITED);
            assertThat(result.getRetryAfter()).isEqualTo(Duration.ofSeconds(60));
        }

        @Test
        @DisplayName("HTTP 4xx is permanent")
        void http4xxIsPermanent() {
            when(client.publish(any())).thenThrow(
                    new ExternalServiceException("automation-service", 422, "bad content", null));

            assertThat(executor.execute(job).getErrorKind()).isEqualTo(ErrorKind.PERMANENT);
        }

        @Test
        @DisplayName("HTTP 5xx and connection errors are transient")
        void serverAndConnectionErrorsAreTransient() {
            when(client.publish(any())).thenThrow(
                    new ExternalServiceException("automation-service", 503, "unavailable", null));
            assertThat(executor.execute(job).getErrorKind()).isEqualTo(ErrorKind.TRANSIENT);

            when(client.publish(any())).thenThrow(new ExternalServiceException("automation-service", "circuit breaker open"));
            assertThat(executor.execute(job).getErrorKind()).isEqualTo(ErrorKind.TRANSIENT);
        }
    }
}
