package com.github.dimitryivaniuta.gateway.esim.service;

import com.github.dimitryivaniuta.gateway.esim.domain.JobStatus;
import com.github.dimitryivaniuta.gateway.esim.domain.ProvisioningJob;
import java.util.List;

/**
 * Durable at-least-once work queue.
 *
 * <p>A claimed job stays invisible for the visibility timeout; if it is neither completed nor failed
 * in that window it is handed out again. Handlers must therefore be idempotent.</p>
 */
public interface JobQueue {

    /**
     * Adds a job. Must run inside the caller's transaction so the job commits with the row it refers to.
     *
     * @param jobType queue name
     * @param deliveryId delivery the job works on
     * @param payload payload, serialized to JSON
     * @return persisted job
     */
    ProvisioningJob enqueue(String jobType, String deliveryId, Object payload);

    /**
     * Claims up to {@code limit} eligible jobs.
     *
     * @param jobType queue name
     * @param limit maximum number of jobs
     * @return claimed jobs, now RUNNING
     */
    List<ProvisioningJob> claim(String jobType, int limit);

    void complete(String jobId);

    /**
     * Records a failed run: schedules a retry with backoff, or marks the job DEAD once its attempts are used up.
     *
     * @param jobId job id
     * @param error failure
     * @return resulting status
     */
    JobStatus fail(String jobId, Throwable error);
}
