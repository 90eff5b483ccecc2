package com.github.dimitryivaniuta.gateway.esim.repo;

import com.github.dimitryivaniuta.gateway.esim.domain.ProvisioningJob;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link ProvisioningJob}.
 */
public interface ProvisioningJobRepository extends JpaRepository<ProvisioningJob, String> {

    /**
     * Locks the next batch of claimable jobs of one type.
     *
     * <p>A job is claimable when it is PENDING/RETRY and due, or RUNNING with an expired lease (the
     * worker that held it died). {@code FOR UPDATE SKIP LOCKED} keeps concurrent pollers from claiming
     * the same row.</p>
     *
     * @param jobType queue name
     * @param now current timestamp
     * @param limit batch size
     * @return locked batch
     */
    @Query(value = """
            select *
            from provisioning_jobs
            where job_type = :jobType
              and (
                    (status in ('PENDING', 'RETRY') and (next_attempt_at is null or next_attempt_at <= :now))
                 or (status = 'RUNNING' and locked_until < :now)
              )
            order by created_at
            for update skip locked
            limit :limit
            """, nativeQuery = true)
    List<ProvisioningJob> lockNextBatchForClaim(
            @Param("jobType") String jobType,
            @Param("now") Instant now,
            @Param("limit") int limit
    );

    /**
     * Counts jobs enqueued for a delivery.
     *
     * @param jobType queue name
     * @param deliveryId delivery id
     * @return count
     */
    long countByJobTypeAndDeliveryId(String jobType, String deliveryId);
}
