package com.github.dimitryivaniuta.gateway.esim.service.dto;

import java.util.List;

/**
 * Outcome of registering an order's line items.
 *
 * @param createdDeliveryIds deliveries created by this notification
 * @param skippedLineItemIds line items that were already registered
 */
public record IntakeResult(List<String> createdDeliveryIds, List<String> skippedLineItemIds) {
}
