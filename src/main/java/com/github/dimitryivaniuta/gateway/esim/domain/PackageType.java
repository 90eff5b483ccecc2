package com.github.dimitryivaniuta.gateway.esim.domain;

/**
 * Vendor package billing model.
 */
public enum PackageType {
    /** One bundle with a fixed validity period. */
    FIXED,
    /** Billed per elapsed day; the order must carry {@code daypassDays}. */
    DAYPASS
}
