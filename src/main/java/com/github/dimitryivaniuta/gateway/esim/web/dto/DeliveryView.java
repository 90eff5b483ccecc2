package com.github.dimitryivaniuta.gateway.esim.web.dto;

import com.github.dimitryivaniuta.gateway.esim.domain.Delivery;
import com.github.dimitryivaniuta.gateway.esim.domain.DeliveryStatus;
import java.time.Instant;

/**
 * Delivery as exposed to support tooling. Activation data and customer email are not included.
 */
public record DeliveryView(
        String id,
        String shop,
        String orderId,
        String orderName,
        String lineItemId,
        String variantId,
        String sku,
        DeliveryStatus status,
        String vendorReferenceId,
        boolean hasActivationData,
        String lastError,
        Instant createdAt,
        Instant updatedAt
) {

    public static DeliveryView from(Delivery d) {
        return new DeliveryView(
                d.getId(),
                d.getShop(),
                d.getOrderId(),
                d.getOrderName(),
                d.getLineItemId(),
                d.getVariantId(),
                d.getSku(),
                d.getStatus(),
                d.getVendorReferenceId(),
                d.getPayloadEncrypted() != null,
                d.getLastError(),
                d.getCreatedAt(),
                d.getUpdatedAt()
        );
    }
}
