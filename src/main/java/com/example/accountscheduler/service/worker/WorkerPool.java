package com.example.accountscheduler.service.worker;

import com.example.accountscheduler.config.MetricsConfig;
import com.example.accountscheduler.config.SchedulerProperties;
import com.example.accountscheduler.service.executor.JobExecutorRegistry;
import com.example.accountscheduler.service.queue.QueueManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code worker-count} independent {@link Worker} loops for the lifetime of the application.
 * <p>
 * There is no coordinator: every worker claims on its own, and account leases keep them apart,
 * across threads and across instances.
 */
@Slf4j
@Component
public class WorkerPool implements SmartLifecycle {

    private final QueueManager queueManager;
    private final JobExecutorRegistry executorRegistry;
    private final MetricsConfig metricsConfig;
    private final SchedulerProperties properties;
    private final Clock clock;
    private final ExecutorService workerLoopExecutor;
    private final ExecutorService jobInvocationExecutor;

    private final List<Worker> workers = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean running;

    @Value("${HOSTNAME:unknown}")
    private String hostname;

    private String instanceId;

    public WorkerPool(QueueManager queueManager, JobExecutorRegistry executorRegistry, MetricsConfig metricsConfig,
                      SchedulerProperties properties, Clock clock,
                      @Qualifier("workerLoopExecutor") ExecutorService workerLoopExecutor,
                      @Qualifier("jobInvocationExecutor") ExecutorService jobInvocationExecutor) {
        this.queueManager = queueManager;
        this.executorRegistry = executorRegistry;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.clock = clock;
        this.workerLoopExecutor = workerLoopExecutor;
        this.jobInvocationExecutor = jobInvocationExecutor;
    }

    /**
     * Unique id of this service instance; worker ids are derived from it
     */
    public String getInstanceId() {
        if (instanceId == null) {
            try {
                var host = InetAddress.getLocalHost().getHostName();
                instanceId = host + "-" + ProcessHandle.current().pid();
            } catch (Exception e) {
                instanceId = hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
            }
        }
        return instanceId;
    }

    @Override
    public void start() {
        if (!properties.getWorker().isEnabled()) {
            log.info("Worker pool disabled (account-scheduler.worker.enabled=false)");
            return;
        }

        for (var i = 0; i < properties.getWorkerCount(); i++) {
            var worker = new Worker(
                    getInstanceId() + "-w" + i,
                    queueManager,
                    executorRegistry,
                    jobInvocationExecutor,
                    metricsConfig,
                    clock,
                    properties.getPollInterval(),
                    properties.getExecutionTimeout());
            workers.add(worker);
            workerLoopExecutor.submit(worker);
        }
        running = true;
        log.info("Started {} workers on instance {} (poll every {}, lease ttl {}, execution timeout {})",
                workers.size(), getInstanceId(), properties.getPollInterval(), properties.getLeaseTtl(),
                properties.getExecutionTimeout());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping {} workers", workers.size());
        workers.forEach(Worker::stop);
        workerLoopExecutor.shutdown();

        try {
            var timeout = properties.getWorker().getShutdownTimeout();
            if (!workerLoopExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not finish within {}; interrupting. Their leases will expire on their own.", timeout);
                workerLoopExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerLoopExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        workers.clear();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
