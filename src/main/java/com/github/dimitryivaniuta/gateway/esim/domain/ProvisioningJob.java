package com.github.dimitryivaniuta.gateway.esim.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Durable unit of work stored in Postgres.
 *
 * <p>Jobs are claimed with {@code FOR UPDATE SKIP LOCKED}; a claimed job is RUNNING until its lease
 * ({@code lockedUntil}) expires, after which another worker may claim it again. Delivery is therefore
 * at-least-once and the handler must be idempotent.</p>
 */
@Entity
@Table(
        name = "provisioning_jobs",
        uniqueConstraints = @UniqueConstraint(name = "uq_job_type_delivery", columnNames = {"job_type", "delivery_id"}),
        indexes = @Index(name = "idx_job_type_status_next", columnList = "job_type,status,next_attempt_at,created_at")
)
@Getter
@Setter
@NoArgsConstructor
public class ProvisioningJob {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "job_type", nullable = false, updatable = false, length = 64)
    private String jobType;

    @Column(name = "delivery_id", nullable = false, updatable = false, length = 36)
    private String deliveryId;

    @Column(name = "payload", nullable = false, columnDefinition = "text")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private JobStatus status;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "locked_until")
    private Instant lockedUntil;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    /**
     * Creates a new pending job.
     *
     * @param jobType queue name
     * @param deliveryId delivery the job provisions
     * @param payload JSON payload
     * @return job
     */
    public static ProvisioningJob newJob(String jobType, String deliveryId, String payload) {
        ProvisioningJob j = new ProvisioningJob();
        j.id = UUID.randomUUID().toString();
        j.jobType = jobType;
        j.deliveryId = deliveryId;
        j.payload = payload;
        j.status = JobStatus.PENDING;
        j.attemptCount = 0;
        j.createdAt = Instant.now();
        j.updatedAt = j.createdAt;
        return j;
    }

    /**
     * Marks the job as claimed by a worker.
     *
     * @param lease how long the claim stays exclusive
     */
    public void markClaimed(Duration lease) {
        Instant now = Instant.now();
        this.status = JobStatus.RUNNING;
        this.attemptCount++;
        this.lockedUntil = now.plus(lease);
        this.nextAttemptAt = null;
        this.updatedAt = now;
    }

    /**
     * Acknowledges the job.
     */
    public void markCompleted() {
        this.status = JobStatus.COMPLETED;
        this.completedAt = Instant.now();
        this.updatedAt = this.completedAt;
        this.lockedUntil = null;
        this.lastError = null;
    }

    /**
     * Schedules another attempt.
     *
     * @param error error string
     * @param backoff delay before the job becomes visible again
     */
    public void markRetry(String error, Duration backoff) {
        this.status = JobStatus.RETRY;
        this.lastError = error;
        this.lockedUntil = null;
        this.nextAttemptAt = Instant.now().plus(backoff);
        this.updatedAt = Instant.now();
    }

    /**
     * Gives up on the job.
     *
     * @param error error string
     */
    public void markDead(String error) {
        this.status = JobStatus.DEAD;
        this.lastError = error;
        this.lockedUntil = null;
        this.nextAttemptAt = null;
        this.updatedAt = Instant.now();
    }
}
