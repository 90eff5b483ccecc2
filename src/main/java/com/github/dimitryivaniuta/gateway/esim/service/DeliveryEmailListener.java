package com.github.dimitryivaniuta.gateway.esim.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.esim.service.events.EsimDeliveredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Consumes delivery events and triggers the activation email.
 */
@Component
public class DeliveryEmailListener {

    private static final Logger log = LoggerFactory.getLogger(DeliveryEmailListener.class);

    private final ObjectMapper objectMapper;
    private final DeliveryEmailService emailService;

    public DeliveryEmailListener(ObjectMapper objectMapper, DeliveryEmailService emailService) {
        this.objectMapper = objectMapper;
        this.emailService = emailService;
    }

    /**
     * Handles one event. Malformed payloads are logged and dropped; send failures are rethrown so the
     * container's error handler redelivers the record.
     *
     * @param payload JSON {@link EsimDeliveredEvent}
     */
    @KafkaListener(
            topics = "${app.outbox.delivery-events-topic:esim-delivery-events}",
            groupId = "${app.email.consumer-group:esim-delivery-email}",
            autoStartup = "${app.email.listener-auto-startup:true}"
    )
    public void consume(String payload) {
        EsimDeliveredEvent event;
        try {
            event = objectMapper.readValue(payload, EsimDeliveredEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Dropping malformed delivery event", e);
            return;
        }

        if (event.deliveryId() == null) {
            log.error("Dropping delivery event {} without deliveryId", event.eventId());
            return;
        }
        emailService.handle(event);
    }
}
