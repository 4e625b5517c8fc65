package com.example.accountscheduler.service.executor;

import com.example.accountscheduler.domain.enums.Platform;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry for job executors.
 * <p>
 * Discovers all JobExecutor beans and provides lookup by platform.
 */
@Slf4j
@Component
public class JobExecutorRegistry {

    private final Map<Platform, JobExecutor> executors = new EnumMap<>(Platform.class);
    private final List<JobExecutor> executorBeans;

    public JobExecutorRegistry(List<JobExecutor> executorBeans) {
        this.executorBeans = executorBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var executor : executorBeans) {
            var platform = executor.getPlatform();
            if (executors.containsKey(platform)) {
                log.warn("Duplicate executor for platform {}: {} will override {}",
                        platform, executor.getClass().getSimpleName(),
                        executors.get(platform).getClass().getSimpleName());
            }
            executors.put(platform, executor);
            log.info("Registered executor for platform {}: {}", platform, executor.getClass().getSimpleName());
        }

        for (var platform : Platform.values()) {
            if (!executors.containsKey(platform)) {
                log.warn("No executor registered for platform: {}", platform);
            }
        }
    }

    public Optional<JobExecutor> getExecutor(Platform platform) {
        return Optional.ofNullable(executors.get(platform));
    }

    public boolean hasExecutor(Platform platform) {
        return executors.containsKey(platform);
    }

    public Set<Platform> getRegisteredPlatforms() {
        return executors.keySet();
    }
}
