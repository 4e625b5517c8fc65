package com.example.accountscheduler.config;

import com.example.accountscheduler.client.AutomationServiceClient;
import com.example.accountscheduler.domain.enums.Platform;
import com.example.accountscheduler.service.executor.JobExecutor;
import com.example.accountscheduler.service.executor.RemoteAutomationExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * One executor bean per platform, all backed by the automation service.
 */
@Configuration
public class ExecutorConfig {

    @Bean
    public JobExecutor tiktokExecutor(AutomationServiceClient client) {
        return new RemoteAutomationExecutor(Platform.TIKTOK, client);
    }

    @Bean
    public JobExecutor instagramReelsExecutor(AutomationServiceClient client) {
        return new RemoteAutomationExecutor(Platform.INSTAGRAM_REELS, client);
    }

    @Bean
    public JobExecutor youtubeShortsExecutor(AutomationServiceClient client) {
        return new RemoteAutomationExecutor(Platform.YOUTUBE_SHORTS, client);
    }
}
