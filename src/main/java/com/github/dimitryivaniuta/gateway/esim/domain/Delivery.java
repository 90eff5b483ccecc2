package com.github.dimitryivaniuta.gateway.esim.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One fulfillment unit per (order, line item) pair.
 *
 * <p>The unique constraint on {@code (order_id, line_item_id)} is what closes the race between two
 * redelivered webhooks; the read-then-write check in the gateway is only the fast path.</p>
 *
 * <p>{@code payloadEncrypted} is set iff the status is {@link DeliveryStatus#DELIVERED}.</p>
 */
@Entity
@Table(
        name = "esim_deliveries",
        uniqueConstraints = @UniqueConstraint(name = "uq_delivery_order_line_item", columnNames = {"order_id", "line_item_id"}),
        indexes = @Index(name = "idx_delivery_status", columnList = "status")
)
@Getter
@Setter
@NoArgsConstructor
public class Delivery {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "shop", nullable = false, length = 255)
    private String shop;

    @Column(name = "order_id", nullable = false, updatable = false, length = 64)
    private String orderId;

    @Column(name = "order_name", nullable = false, length = 64)
    private String orderName;

    @Column(name = "line_item_id", nullable = false, updatable = false, length = 64)
    private String lineItemId;

    @Column(name = "variant_id", nullable = false, length = 64)
    private String variantId;

    @Column(name = "sku", length = 128)
    private String sku;

    @Column(name = "customer_email", length = 320)
    private String customerEmail;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private DeliveryStatus status;

    @Column(name = "vendor_reference_id", length = 128)
    private String vendorReferenceId;

    @Column(name = "payload_encrypted", columnDefinition = "text")
    private String payloadEncrypted;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Creates a new pending delivery.
     *
     * @param shop shop domain the notification came from
     * @param orderId storefront order id
     * @param orderName human readable order name (e.g. {@code #1001})
     * @param lineItemId storefront line item id
     * @param variantId storefront variant id
     * @param sku storefront SKU, may be null
     * @param customerEmail customer email
     * @return delivery
     */
    public static Delivery pending(String shop, String orderId, String orderName, String lineItemId,
                                   String variantId, String sku, String customerEmail) {
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(lineItemId, "lineItemId");

        Delivery d = new Delivery();
        d.id = UUID.randomUUID().toString();
        d.shop = shop == null ? "unknown" : shop;
        d.orderId = orderId;
        d.orderName = orderName == null ? orderId : orderName;
        d.lineItemId = lineItemId;
        d.variantId = variantId == null ? "" : variantId;
        d.sku = sku;
        d.customerEmail = customerEmail;
        d.status = DeliveryStatus.PENDING;
        d.createdAt = Instant.now();
        d.updatedAt = d.createdAt;
        return d;
    }

    /**
     * Marks the delivery as being provisioned.
     */
    public void markProvisioning() {
        this.status = DeliveryStatus.PROVISIONING;
        this.updatedAt = Instant.now();
    }

    /**
     * Marks the delivery as delivered and stores the encrypted activation payload.
     *
     * @param vendorReferenceId vendor order number
     * @param payloadEncrypted encrypted canonical payload
     */
    public void markDelivered(String vendorReferenceId, String payloadEncrypted) {
        Objects.requireNonNull(payloadEncrypted, "payloadEncrypted");
        this.status = DeliveryStatus.DELIVERED;
        this.vendorReferenceId = vendorReferenceId;
        this.payloadEncrypted = payloadEncrypted;
        this.lastError = null;
        this.updatedAt = Instant.now();
    }

    /**
     * Marks the delivery as failed.
     *
     * @param error failure description
     */
    public void markFailed(String error) {
        this.status = DeliveryStatus.FAILED;
        this.payloadEncrypted = null;
        this.lastError = error;
        this.updatedAt = Instant.now();
    }

    /**
     * @return true if the activation payload was already obtained
     */
    public boolean isDelivered() {
        return status == DeliveryStatus.DELIVERED;
    }
}
