package com.github.dimitryivaniuta.gateway.esim.service.dto;

/**
 * Outcome reported by a {@code DeliveryEmailSender}.
 *
 * @param success whether the provider accepted the message
 * @param messageId provider message id, may be null
 * @param error provider error, may be null
 */
public record DeliveryEmailResult(boolean success, String messageId, String error) {

    public static DeliveryEmailResult sent(String messageId) {
        return new DeliveryEmailResult(true, messageId, null);
    }

    public static DeliveryEmailResult failed(String error) {
        return new DeliveryEmailResult(false, null, error);
    }
}
