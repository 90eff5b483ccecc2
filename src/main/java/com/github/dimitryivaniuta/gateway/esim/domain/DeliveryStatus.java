package com.github.dimitryivaniuta.gateway.esim.domain;

/**
 * Fulfillment status of a single order line item.
 */
public enum DeliveryStatus {
    /** Created by the webhook, job enqueued, not yet picked up. */
    PENDING,

    /** A worker is placing the vendor order. */
    PROVISIONING,

    /** Activation payload obtained and stored encrypted. */
    DELIVERED,

    /** Last provisioning attempt failed; the queue may retry. */
    FAILED
}
