package com.github.dimitryivaniuta.gateway.esim.service;

import com.github.dimitryivaniuta.gateway.esim.service.dto.DeliveryEmailRequest;
import com.github.dimitryivaniuta.gateway.esim.service.dto.DeliveryEmailResult;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default sender for environments without a mail provider: logs the send and reports success.
 */
@Slf4j
@Component
public class LoggingDeliveryEmailSender implements DeliveryEmailSender {

    @Override
    public DeliveryEmailResult sendDeliveryEmail(DeliveryEmailRequest request) {
        String messageId = "log-" + UUID.randomUUID();
        log.info("Delivery email for {} ({}) accepted. messageId={}", request.orderName(), request.deliveryId(), messageId);
        return DeliveryEmailResult.sent(messageId);
    }
}
