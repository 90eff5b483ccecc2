package com.github.dimitryivaniuta.gateway.esim.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The part of the storefront {@code orders/paid} notification this service reads.
 *
 * @param id order id
 * @param name order name, e.g. {@code #1001}
 * @param email order email
 * @param customer customer, may be null for guest checkouts
 * @param lineItems purchased line items
 */
public record OrderPaidNotification(
        String id,
        String name,
        String email,
        Customer customer,
        @JsonProperty("line_items") List<LineItem> lineItems
) {

    /**
     * Customer email, falling back to the order email.
     *
     * @return email or null
     */
    public String customerEmail() {
        if (customer != null && customer.email() != null && !customer.email().isBlank()) {
            return customer.email();
        }
        return email == null || email.isBlank() ? null : email;
    }

    public List<LineItem> lineItemsOrEmpty() {
        return lineItems == null ? List.of() : lineItems;
    }

    public record Customer(String id, String email) {
    }

    public record LineItem(
            String id,
            @JsonProperty("variant_id") String variantId,
            Integer quantity,
            String title,
            String sku
    ) {
    }
}
