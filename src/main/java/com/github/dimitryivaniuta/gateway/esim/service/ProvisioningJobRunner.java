package com.github.dimitryivaniuta.gateway.esim.service;

import com.github.dimitryivaniuta.gateway.esim.config.AppProperties;
import com.github.dimitryivaniuta.gateway.esim.domain.JobStatus;
import com.github.dimitryivaniuta.gateway.esim.domain.ProvisioningJob;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls the provisioning queue and runs jobs on a bounded executor.
 *
 * <p>Never more than {@code app.queue.max-concurrency} jobs are claimed and running in this process at
 * once. Rejected hand-offs are left RUNNING and come back when their lease expires.</p>
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.queue", name = "worker-enabled", havingValue = "true", matchIfMissing = true)
public class ProvisioningJobRunner {

    static final String MDC_JOB_ID = "jobId";
    static final String MDC_DELIVERY_ID = "deliveryId";

    private final JobQueue jobQueue;
    private final ProvisionEsimJobHandler handler;
    private final Executor executor;
    private final AppProperties properties;
    private final AtomicInteger inFlight = new AtomicInteger();

    private final Counter completedCounter;
    private final Counter failedCounter;

    public ProvisioningJobRunner(
            JobQueue jobQueue,
            ProvisionEsimJobHandler handler,
            @Qualifier("provisioningExecutor") Executor executor,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.jobQueue = jobQueue;
        this.handler = handler;
        this.executor = executor;
        this.properties = properties;

        this.completedCounter = Counter.builder("esim.jobs.completed").register(meterRegistry);
        this.failedCounter = Counter.builder("esim.jobs.failed").register(meterRegistry);
    }

    /**
     * Claims as many jobs as there are free slots and hands them to the executor.
     */
    @Scheduled(fixedDelayString = "${app.queue.poll-interval-ms:1000}")
    public void poll() {
        AppProperties.Queue queue = properties.getQueue();
        int capacity = queue.getMaxConcurrency() - inFlight.get();
        if (capacity <= 0) {
            return;
        }

        List<ProvisioningJob> jobs = jobQueue.claim(queue.getProvisionJobType(), capacity);
        for (ProvisioningJob job : jobs) {
            inFlight.incrementAndGet();
            try {
                executor.execute(() -> run(job));
            } catch (TaskRejectedException e) {
                inFlight.decrementAndGet();
                log.warn("Executor rejected job {}; it will be reclaimed after its lease expires", job.getId());
            }
        }
    }

    /**
     * Runs one claimed job and acknowledges or fails it.
     *
     * @param job claimed job
     */
    void run(ProvisioningJob job) {
        MDC.put(MDC_JOB_ID, job.getId());
        MDC.put(MDC_DELIVERY_ID, job.getDeliveryId());
        try {
            handler.handle(job);
            jobQueue.complete(job.getId());
            completedCounter.increment();
            log.info("Job {} completed", job.getId());
        } catch (Exception e) {
            failedCounter.increment();
            JobStatus status = jobQueue.fail(job.getId(), e);
            log.warn("Job {} failed, now {}: {}", job.getId(), status, e.getMessage());
        } finally {
            inFlight.decrementAndGet();
            MDC.remove(MDC_JOB_ID);
            MDC.remove(MDC_DELIVERY_ID);
        }
    }

    int inFlight() {
        return inFlight.get();
    }
}
