package com.example.accountscheduler.service.alert;

import com.example.accountscheduler.config.SlackProperties;
import com.example.accountscheduler.domain.entity.Job;
import com.example.accountscheduler.time.UtcTimestamps;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

/**
 * Sends Slack alerts for jobs that need an operator: permanent failures and exhausted retries.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Clock clock;
    private final Slack slack;

    @Value("${spring.application.name:account-job-scheduler}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties, Clock clock) {
        this(slackProperties, clock, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Clock clock, Slack slack) {
        this.slackProperties = slackProperties;
        this.clock = clock;
        this.slack = slack;
    }

    /**
     * Runs asynchronously to not block the worker that completed the job.
     */
    @Async
    public void sendPermanentFailureAlert(Job job) {
        send(job, ":no_entry: *Job Failed Permanently*", "Retrying cannot help; check the account and content");
    }

    @Async
    public void sendRetriesExhaustedAlert(Job job) {
        send(job, ":rotating_light: *Job Retries Exhausted - Manual Intervention Required*",
                "Please investigate and re-schedule or drop the job");
    }

    private void send(Job job, String headline, String footerHint) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Job {} failed but no alert was sent.", job.getId());
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildPayload(job, headline, footerHint));

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for job {}", job.getId());
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for job {}: {}", job.getId(), e.getMessage(), e);
        }
    }

    boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
    }

    Payload buildPayload(Job job, String headline, String footerHint) {
        var jobId = job.getId().toString();
        var lastError = job.getLastError();
        var errorText = lastError != null && lastError.getMessage() != null ? lastError.getMessage() : "Unknown error";
        var errorKind = lastError != null && lastError.getKind() != null ? lastError.getKind().name() : "-";

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(headline)
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(job.getPlatform().getDisplayName() + " - " + job.getAccountId())
                                .titleLink(slackProperties.getDashboardBaseUrl() + "/jobs/" + jobId)
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Job ID")
                                                .value(jobId)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Account")
                                                .value(job.getAccountId())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Content")
                                                .value(truncate(job.getContentRef(), 100))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Retries")
                                                .value(job.getRetryCount() + " / " + job.getMaxRetries())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Scheduled At")
                                                .value(UtcTimestamps.format(job.getScheduledAt()))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Error Kind")
                                                .value(errorKind)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(errorText, 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | " + footerHint)
                                .ts(String.valueOf(clock.instant().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
