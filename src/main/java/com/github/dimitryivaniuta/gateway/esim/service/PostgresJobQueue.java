package com.github.dimitryivaniuta.gateway.esim.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.esim.config.AppProperties;
import com.github.dimitryivaniuta.gateway.esim.domain.JobStatus;
import com.github.dimitryivaniuta.gateway.esim.domain.ProvisioningJob;
import com.github.dimitryivaniuta.gateway.esim.repo.ProvisioningJobRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link JobQueue} on a Postgres table.
 *
 * <p>Claims use {@code FOR UPDATE SKIP LOCKED}, so any number of worker instances can poll the same
 * table without handing a job to two of them inside its lease.</p>
 */
@Service
public class PostgresJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(PostgresJobQueue.class);

    private final ProvisioningJobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final AppProperties properties;

    private final Counter enqueuedCounter;
    private final Counter retryCounter;
    private final Counter deadCounter;

    public PostgresJobQueue(
            ProvisioningJobRepository jobRepository,
            ObjectMapper objectMapper,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.jobRepository = jobRepository;
        this.objectMapper = objectMapper;
        this.properties = properties;

        this.enqueuedCounter = Counter.builder("esim.jobs.enqueued").register(meterRegistry);
        this.retryCounter = Counter.builder("esim.jobs.retry").register(meterRegistry);
        this.deadCounter = Counter.builder("esim.jobs.dead").register(meterRegistry);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public ProvisioningJob enqueue(String jobType, String deliveryId, Object payload) {
        ProvisioningJob job = jobRepository.save(ProvisioningJob.newJob(jobType, deliveryId, toJson(payload)));
        enqueuedCounter.increment();
        return job;
    }

    @Override
    @Transactional
    public List<ProvisioningJob> claim(String jobType, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Duration lease = properties.getQueue().getVisibilityTimeout();
        List<ProvisioningJob> batch = jobRepository.lockNextBatchForClaim(jobType, Instant.now(), limit);
        for (ProvisioningJob job : batch) {
            if (job.getStatus() == JobStatus.RUNNING) {
                log.warn("Reclaiming job {} after its lease expired. attempt={}", job.getId(), job.getAttemptCount());
            }
            job.markClaimed(lease);
        }
        return jobRepository.saveAll(batch);
    }

    @Override
    @Transactional
    public void complete(String jobId) {
        jobRepository.findById(jobId).ifPresent(job -> {
            job.markCompleted();
            jobRepository.save(job);
        });
    }

    @Override
    @Transactional
    public JobStatus fail(String jobId, Throwable error) {
        ProvisioningJob job = jobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalStateException("Job " + jobId + " not found"));
        AppProperties.Queue queue = properties.getQueue();
        String err = Backoff.errorText(error);

        if (job.getAttemptCount() >= queue.getMaxAttempts()) {
            job.markDead(err);
            deadCounter.increment();
            log.error("Job {} moved to DEAD after {} attempts. deliveryId={} error={}",
                    job.getId(), job.getAttemptCount(), job.getDeliveryId(), err);
        } else {
            Duration backoff = Backoff.compute(queue.getBaseBackoff(), queue.getMaxBackoff(), job.getAttemptCount());
            job.markRetry(err, backoff);
            retryCounter.increment();
            log.warn("Job {} failed. attempt={} nextAttemptAt={} deliveryId={} error={}",
                    job.getId(), job.getAttemptCount(), job.getNextAttemptAt(), job.getDeliveryId(), err);
        }

        jobRepository.save(job);
        return job.getStatus();
    }

    private String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize job payload", e);
        }
    }
}
