package com.github.dimitryivaniuta.gateway.esim.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One attempt to hand an activation payload to the customer over a channel.
 */
@Entity
@Table(
        name = "delivery_attempts",
        indexes = @Index(name = "idx_delivery_attempt_delivery_channel", columnList = "delivery_id,channel,result")
)
@Getter
@NoArgsConstructor
public class DeliveryAttempt {

    /** Email channel. */
    public static final String CHANNEL_EMAIL = "EMAIL";

    /** Result of an accepted send. */
    public static final String RESULT_SENT = "SENT";

    /** Result of a rejected send. */
    public static final String RESULT_FAILED = "FAILED";

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "delivery_id", nullable = false, updatable = false, length = 36)
    private String deliveryId;

    @Column(name = "channel", nullable = false, updatable = false, length = 16)
    private String channel;

    @Column(name = "result", nullable = false, updatable = false, length = 16)
    private String result;

    @Column(name = "message_id", updatable = false, length = 255)
    private String messageId;

    @Column(name = "error", updatable = false, columnDefinition = "text")
    private String error;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static DeliveryAttempt sent(String deliveryId, String channel, String messageId) {
        return newAttempt(deliveryId, channel, RESULT_SENT, messageId, null);
    }

    public static DeliveryAttempt failed(String deliveryId, String channel, String error) {
        return newAttempt(deliveryId, channel, RESULT_FAILED, null, error);
    }

    private static DeliveryAttempt newAttempt(String deliveryId, String channel, String result, String messageId, String error) {
        DeliveryAttempt a = new DeliveryAttempt();
        a.id = UUID.randomUUID().toString();
        a.deliveryId = deliveryId;
        a.channel = channel;
        a.result = result;
        a.messageId = messageId;
        a.error = error;
        a.createdAt = Instant.now();
        return a;
    }
}
