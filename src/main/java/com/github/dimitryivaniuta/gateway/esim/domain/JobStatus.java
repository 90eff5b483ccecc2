package com.github.dimitryivaniuta.gateway.esim.domain;

/**
 * Provisioning job status.
 *
 * <p>Stored as VARCHAR; values are enforced in code.</p>
 */
public enum JobStatus {
    /** Enqueued, never claimed. */
    PENDING,
    /** Claimed by a worker; visible again once {@code lockedUntil} passes. */
    RUNNING,
    /** Failed before; eligible again after {@code nextAttemptAt}. */
    RETRY,
    /** Acknowledged by the worker. */
    COMPLETED,
    /** Gave up after max attempts. */
    DEAD
}
