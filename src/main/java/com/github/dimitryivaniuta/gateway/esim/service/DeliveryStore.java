package com.github.dimitryivaniuta.gateway.esim.service;

import com.github.dimitryivaniuta.gateway.esim.domain.Delivery;
import com.github.dimitryivaniuta.gateway.esim.domain.VendorOrderAttempt;
import java.util.Optional;

/**
 * Persistence operations the vendor client and the worker depend on.
 *
 * <p>Kept as an interface so both can be tested without a database.</p>
 */
public interface DeliveryStore {

    Optional<Delivery> findDelivery(String deliveryId);

    /**
     * Persists a state change of a delivery that does not publish anything (provisioning, failed).
     *
     * @param delivery delivery
     * @return saved delivery
     */
    Delivery updateDelivery(Delivery delivery);

    /**
     * Marks a delivery DELIVERED and writes the {@code EsimDelivered} outbox event atomically.
     *
     * @param deliveryId delivery id
     * @param vendorReferenceId vendor order number
     * @param payloadEncrypted encrypted canonical payload
     * @return updated delivery
     */
    Delivery markDelivered(String deliveryId, String vendorReferenceId, String payloadEncrypted);

    /**
     * Appends a vendor order attempt.
     *
     * @param attempt attempt
     * @return saved attempt
     */
    VendorOrderAttempt createVendorOrderAttempt(VendorOrderAttempt attempt);
}
