package com.github.dimitryivaniuta.gateway.esim.domain;

/**
 * Outcome of extracting an activation payload from a successful vendor order.
 */
public enum VendorOrderAttemptStatus {
    /** Canonical payload extracted and validated. */
    CREATED,

    /** Vendor accepted the order but the card data could not be normalized. */
    INVALID_PAYLOAD
}
