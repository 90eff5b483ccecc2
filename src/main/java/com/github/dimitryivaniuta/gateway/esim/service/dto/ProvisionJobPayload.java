package com.github.dimitryivaniuta.gateway.esim.service.dto;

import java.util.Map;

/**
 * JSON payload of a {@code provision-esim} job.
 *
 * @param deliveryId delivery to provision
 * @param orderId storefront order id
 * @param orderName storefront order name
 * @param lineItemId storefront line item id
 * @param variantId storefront variant id
 * @param customerEmail customer email
 * @param sku storefront SKU, may be null
 * @param orderPayload explicit vendor order fields; when present the SKU mapping is not consulted
 */
public record ProvisionJobPayload(
        String deliveryId,
        String orderId,
        String orderName,
        String lineItemId,
        String variantId,
        String customerEmail,
        String sku,
        Map<String, Object> orderPayload
) {
}
