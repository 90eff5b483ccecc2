package com.github.dimitryivaniuta.gateway.esim.service;

/**
 * The activation email could not be sent; the event is redelivered by the Kafka error handler.
 */
public class DeliveryEmailException extends RuntimeException {

    public DeliveryEmailException(String message) {
        super(message);
    }
}
