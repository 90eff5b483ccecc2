package com.github.dimitryivaniuta.gateway.esim.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Event written in the same transaction as a {@link Delivery} state change and published to Kafka
 * asynchronously.
 *
 * <p>Payloads reference deliveries by id only; activation secrets never leave the database through
 * this table.</p>
 */
@Entity
@Table(
        name = "outbox_events",
        indexes = @Index(name = "idx_outbox_status_next_created", columnList = "status,next_attempt_at,created_at")
)
@Getter
@Setter
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "aggregate_type", nullable = false, length = 64)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, length = 64)
    private String aggregateId;

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    @Column(name = "event_key", nullable = false, length = 128)
    private String eventKey;

    @Column(name = "payload", nullable = false, columnDefinition = "text")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private OutboxStatus status;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "sent_at")
    private Instant sentAt;

    /**
     * Creates an unpublished event.
     *
     * @param aggregateType aggregate type, e.g. {@code EsimDelivery}
     * @param aggregateId aggregate id
     * @param eventType event type
     * @param eventKey Kafka key
     * @param payload JSON payload
     * @return event
     */
    public static OutboxEvent newEvent(String aggregateType, String aggregateId, String eventType, String eventKey, String payload) {
        OutboxEvent e = new OutboxEvent();
        e.id = UUID.randomUUID().toString();
        e.aggregateType = aggregateType;
        e.aggregateId = aggregateId;
        e.eventType = eventType;
        e.eventKey = eventKey;
        e.payload = payload;
        e.status = OutboxStatus.NEW;
        e.createdAt = Instant.now();
        e.updatedAt = e.createdAt;
        return e;
    }

    public void markSent() {
        this.status = OutboxStatus.SENT;
        this.sentAt = Instant.now();
        this.updatedAt = this.sentAt;
        this.nextAttemptAt = null;
        this.lastError = null;
    }

    public void markRetry(String error, Duration backoff) {
        this.status = OutboxStatus.RETRY;
        this.attemptCount++;
        this.lastError = error;
        this.nextAttemptAt = Instant.now().plus(backoff);
        this.updatedAt = Instant.now();
    }

    public void markDead(String error) {
        this.status = OutboxStatus.DEAD;
        this.attemptCount++;
        this.lastError = error;
        this.nextAttemptAt = null;
        this.updatedAt = Instant.now();
    }
}
