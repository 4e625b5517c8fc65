package com.example.accountscheduler;

import com.example.accountscheduler.cli.SchedulerCommandRunner;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.MapPropertySource;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Map;

/**
 * Account Job Scheduler Application
 * <p>
 * Schedules and executes per-account automation jobs against rate-limited,
 * proxy-bound accounts.
 * <p>
 * Features:
 * - Per-account leases so no two jobs run against the same account at once
 * - Crash-safe locking through lease expiry
 * - UTC-correct scheduling
 * - Bounded exponential backoff with jitter for transient failures
 * - Fixed-window rate limiting per account and platform
 * <p>
 * Started with one of the {@link SchedulerCommandRunner#COMMANDS} as first argument the
 * application runs that command and exits without starting the workers or the web server.
 */
@EnableScheduling
@SpringBootApplication
public class AccountSchedulerApplication {

    static final String CLI_PROPERTY_SOURCE = "schedulerCli";

    public static void main(String[] args) {
        var application = new SpringApplication(AccountSchedulerApplication.class);

        if (SchedulerCommandRunner.isCommand(args)) {
            configureForCommand(application);
            System.exit(SpringApplication.exit(application.run(args)));
        }

        application.run(args);
    }

    /**
     * One-shot command mode: no web server, no banner, and no worker loops or housekeeping.
     * The worker switch is added ahead of every other property source, so no configuration
     * can turn the workers back on.
     */
    static void configureForCommand(SpringApplication application) {
        application.setWebApplicationType(WebApplicationType.NONE);
        application.setBannerMode(Banner.Mode.OFF);
        application.addInitializers(context -> context.getEnvironment().getPropertySources().addFirst(
                new MapPropertySource(CLI_PROPERTY_SOURCE, Map.of("account-scheduler.worker.enabled", "false"))));
    }
}
