package com.example.accountscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools for the worker loops, executor invocations and @Async alerts.
 * <p>
 * Worker loops run on a fixed pool, one thread per worker. Executor invocations run on a
 * separate pool so a worker can stop waiting when the execution timeout passes; an invocation
 * that ignores interruption keeps its thread until it returns, hence the pool is unbounded.
 */
@Slf4j
@EnableAsync
@Configuration
public class WorkerPoolConfig {

    @Bean(name = "workerLoopExecutor", destroyMethod = "shutdownNow")
    public ExecutorService workerLoopExecutor(SchedulerProperties properties) {
        log.info("Creating worker loop pool with {} threads", properties.getWorkerCount());

        return Executors.newFixedThreadPool(properties.getWorkerCount(), new CustomizableThreadFactory("job-worker-"));
    }

    @Bean(name = "jobInvocationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService jobInvocationExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("job-exec-"));
    }

    /**
     * Task executor for Spring's @Async annotation (Slack alerts).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("async-alert-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}
