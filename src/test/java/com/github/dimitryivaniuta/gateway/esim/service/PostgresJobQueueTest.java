package com.github.dimitryivaniuta.gateway.esim.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.esim.config.AppProperties;
import com.github.dimitryivaniuta.gateway.esim.domain.JobStatus;
import com.github.dimitryivaniuta.gateway.esim.domain.ProvisioningJob;
import com.github.dimitryivaniuta.gateway.esim.repo.ProvisioningJobRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

class PostgresJobQueueTest {

    private ProvisioningJobRepository repo;
    private AppProperties props;
    private SimpleMeterRegistry meters;
    private PostgresJobQueue queue;

    @BeforeEach
    void setUp() {
        repo = Mockito.mock(ProvisioningJobRepository.class);
        props = new AppProperties();
        props.getQueue().setMaxAttempts(3);
        props.getQueue().setBaseBackoff(Duration.ofSeconds(10));
        props.getQueue().setMaxBackoff(Duration.ofMinutes(10));
        meters = new SimpleMeterRegistry();
        queue = new PostgresJobQueue(repo, new ObjectMapper(), props, meters);

        Mockito.when(repo.save(ArgumentMatchers.any(ProvisioningJob.class))).thenAnswer(inv -> inv.getArgument(0));
        Mockito.when(repo.saveAll(ArgumentMatchers.anyList())).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void enqueueStoresPendingJobWithJsonPayload() {
        ProvisioningJob job = queue.enqueue("provision-esim", "d-1", Map.of("deliveryId", "d-1"));

        Assertions.assertEquals(JobStatus.PENDING, job.getStatus());
        Assertions.assertEquals(0, job.getAttemptCount());
        Assertions.assertEquals("{\"deliveryId\":\"d-1\"}", job.getPayload());
        Assertions.assertEquals(1.0, meters.counter("esim.jobs.enqueued").count());
    }

    @Test
    void claimLeasesJobsAndCountsTheAttempt() {
        ProvisioningJob job = ProvisioningJob.newJob("provision-esim", "d-1", "{}");
        Mockito.when(repo.lockNextBatchForClaim(ArgumentMatchers.eq("provision-esim"), ArgumentMatchers.any(Instant.class), ArgumentMatchers.eq(2)))
                .thenReturn(List.of(job));

        List<ProvisioningJob> claimed = queue.claim("provision-esim", 2);

        Assertions.assertEquals(1, claimed.size());
        Assertions.assertEquals(JobStatus.RUNNING, job.getStatus());
        Assertions.assertEquals(1, job.getAttemptCount());
        Assertions.assertTrue(job.getLockedUntil().isAfter(Instant.now().plus(Duration.ofMinutes(4))));
    }

    @Test
    void claimWithoutCapacityDoesNotTouchTheTable() {
        Assertions.assertTrue(queue.claim("provision-esim", 0).isEmpty());
        Mockito.verifyNoInteractions(repo);
    }

    @Test
    void completeAcknowledges() {
        ProvisioningJob job = ProvisioningJob.newJob("provision-esim", "d-1", "{}");
        job.markClaimed(Duration.ofMinutes(5));
        Mockito.when(repo.findById(job.getId())).thenReturn(Optional.of(job));

        queue.complete(job.getId());

        Assertions.assertEquals(JobStatus.COMPLETED, job.getStatus());
        Assertions.assertNotNull(job.getCompletedAt());
        Assertions.assertNull(job.getLockedUntil());
    }

    @Test
    void failBeforeMaxAttemptsSchedulesRetryWithBackoff() {
        ProvisioningJob job = ProvisioningJob.newJob("provision-esim", "d-1", "{}");
        job.markClaimed(Duration.ofMinutes(5));
        Mockito.when(repo.findById(job.getId())).thenReturn(Optional.of(job));

        Instant before = Instant.now();
        JobStatus status = queue.fail(job.getId(), new ProvisioningFailedException("FiRoam error: code=3 message=data not exist"));

        Assertions.assertEquals(JobStatus.RETRY, status);
        Assertions.assertEquals("FiRoam error: code=3 message=data not exist", job.getLastError());
        Assertions.assertFalse(job.getNextAttemptAt().isBefore(before.plus(Duration.ofSeconds(10))));
        Assertions.assertFalse(job.getNextAttemptAt().isAfter(Instant.now().plus(Duration.ofMinutes(10))));
        Assertions.assertEquals(1.0, meters.counter("esim.jobs.retry").count());
    }

    @Test
    void failOnLastAttemptIsDead() {
        ProvisioningJob job = ProvisioningJob.newJob("provision-esim", "d-1", "{}");
        job.setAttemptCount(2);
        job.markClaimed(Duration.ofMinutes(5));
        Mockito.when(repo.findById(job.getId())).thenReturn(Optional.of(job));

        JobStatus status = queue.fail(job.getId(), new IllegalStateException());

        Assertions.assertEquals(JobStatus.DEAD, status);
        Assertions.assertEquals("IllegalStateException", job.getLastError());
        Assertions.assertNull(job.getNextAttemptAt());
        Assertions.assertEquals(1.0, meters.counter("esim.jobs.dead").count());
    }
}
