package com.github.dimitryivaniuta.gateway.esim.service;

import com.github.dimitryivaniuta.gateway.esim.service.dto.DeliveryEmailRequest;
import com.github.dimitryivaniuta.gateway.esim.service.dto.DeliveryEmailResult;

/**
 * Sends the activation email. Rendering and transport are up to the implementation.
 */
public interface DeliveryEmailSender {

    DeliveryEmailResult sendDeliveryEmail(DeliveryEmailRequest request);
}
