package com.github.dimitryivaniuta.gateway.esim.service.events;

import java.time.Instant;

/**
 * Event emitted when activation data for a delivery has been obtained and stored.
 *
 * <p>Stored in the outbox and later published to Kafka. Consumers load the encrypted payload by
 * {@code deliveryId}; the event itself carries no activation data.</p>
 */
public record EsimDeliveredEvent(
        String schemaVersion,
        String eventId,
        Instant occurredAt,
        String deliveryId,
        String orderId,
        String orderName,
        String lineItemId,
        String customerEmail,
        String sku,
        String vendorReferenceId
) {

    /** Outbox aggregate type. */
    public static final String AGGREGATE_TYPE = "EsimDelivery";

    /** Outbox event type. */
    public static final String EVENT_TYPE = "EsimDelivered";
}
