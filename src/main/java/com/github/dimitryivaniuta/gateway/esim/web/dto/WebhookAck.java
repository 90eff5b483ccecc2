package com.github.dimitryivaniuta.gateway.esim.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body returned to the storefront once a notification was accepted.
 *
 * @param received always true
 * @param error set when processing failed after acceptance
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookAck(boolean received, String error) {

    public static WebhookAck ok() {
        return new WebhookAck(true, null);
    }

    public static WebhookAck processingError() {
        return new WebhookAck(true, "Processing error");
    }
}
