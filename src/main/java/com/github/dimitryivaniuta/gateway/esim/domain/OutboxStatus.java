package com.github.dimitryivaniuta.gateway.esim.domain;

/**
 * Publication status of a delivery notification event.
 *
 * <p>Kept as VARCHAR in the DB; values are enforced in code.</p>
 */
public enum OutboxStatus {
    /** Written together with the delivered transition, never published. */
    NEW,
    /** Publish failed; retried after {@code nextAttemptAt}. */
    RETRY,
    /** Acknowledged by Kafka. */
    SENT,
    /** Gave up after max attempts. */
    DEAD
}
