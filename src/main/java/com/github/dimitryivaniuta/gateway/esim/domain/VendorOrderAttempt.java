package com.github.dimitryivaniuta.gateway.esim.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Append-only audit record of a vendor order whose response was received.
 *
 * <p>Written once, right after canonical extraction succeeded or failed. There are no setters:
 * rows are never mutated.</p>
 */
@Entity
@Table(
        name = "vendor_order_attempts",
        indexes = {
                @Index(name = "idx_vendor_attempt_reference", columnList = "vendor_reference_id"),
                @Index(name = "idx_vendor_attempt_delivery", columnList = "delivery_id")
        }
)
@Getter
@NoArgsConstructor
public class VendorOrderAttempt {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "delivery_id", updatable = false, length = 36)
    private String deliveryId;

    @Column(name = "vendor_reference_id", nullable = false, updatable = false, length = 128)
    private String vendorReferenceId;

    @Column(name = "payload_json", updatable = false, columnDefinition = "text")
    private String payloadJson;

    @Column(name = "payload_encrypted", updatable = false, columnDefinition = "text")
    private String payloadEncrypted;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, updatable = false, length = 32)
    private VendorOrderAttemptStatus status;

    @Column(name = "last_error", updatable = false, columnDefinition = "text")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Attempt whose canonical payload validated.
     *
     * @param deliveryId owning delivery, may be null for ad-hoc orders
     * @param vendorReferenceId vendor order number
     * @param payloadJson canonical payload JSON
     * @param payloadEncrypted encrypted canonical payload JSON
     * @return attempt
     */
    public static VendorOrderAttempt created(String deliveryId, String vendorReferenceId, String payloadJson, String payloadEncrypted) {
        return newAttempt(deliveryId, vendorReferenceId, payloadJson, payloadEncrypted, VendorOrderAttemptStatus.CREATED, null);
    }

    /**
     * Attempt whose card data failed validation.
     *
     * @param deliveryId owning delivery, may be null
     * @param vendorReferenceId vendor order number
     * @param payloadJson normalized (invalid) payload JSON
     * @param payloadEncrypted encrypted payload JSON
     * @param error validation error
     * @return attempt
     */
    public static VendorOrderAttempt invalidPayload(String deliveryId, String vendorReferenceId, String payloadJson,
                                                    String payloadEncrypted, String error) {
        return newAttempt(deliveryId, vendorReferenceId, payloadJson, payloadEncrypted, VendorOrderAttemptStatus.INVALID_PAYLOAD, error);
    }

    private static VendorOrderAttempt newAttempt(String deliveryId, String vendorReferenceId, String payloadJson,
                                                 String payloadEncrypted, VendorOrderAttemptStatus status, String error) {
        VendorOrderAttempt a = new VendorOrderAttempt();
        a.id = UUID.randomUUID().toString();
        a.deliveryId = deliveryId;
        a.vendorReferenceId = vendorReferenceId;
        a.payloadJson = payloadJson;
        a.payloadEncrypted = payloadEncrypted;
        a.status = status;
        a.lastError = error;
        a.createdAt = Instant.now();
        return a;
    }
}
