package com.github.dimitryivaniuta.gateway.esim.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.esim.domain.Delivery;
import com.github.dimitryivaniuta.gateway.esim.domain.OutboxEvent;
import com.github.dimitryivaniuta.gateway.esim.domain.VendorOrderAttempt;
import com.github.dimitryivaniuta.gateway.esim.repo.DeliveryRepository;
import com.github.dimitryivaniuta.gateway.esim.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.gateway.esim.repo.VendorOrderAttemptRepository;
import com.github.dimitryivaniuta.gateway.esim.service.events.EsimDeliveredEvent;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link DeliveryStore} backed by Spring Data JPA.
 */
@Service
public class JpaDeliveryStore implements DeliveryStore {

    private final DeliveryRepository deliveryRepository;
    private final VendorOrderAttemptRepository attemptRepository;
    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    public JpaDeliveryStore(
            DeliveryRepository deliveryRepository,
            VendorOrderAttemptRepository attemptRepository,
            OutboxEventRepository outboxEventRepository,
            ObjectMapper objectMapper
    ) {
        this.deliveryRepository = deliveryRepository;
        this.attemptRepository = attemptRepository;
        this.outboxEventRepository = outboxEventRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Delivery> findDelivery(String deliveryId) {
        return deliveryRepository.findById(deliveryId);
    }

    @Override
    @Transactional
    public Delivery updateDelivery(Delivery delivery) {
        return deliveryRepository.save(delivery);
    }

    /**
     * Delivery row and outbox row are committed together, so a delivered eSIM always has exactly one
     * notification event.
     */
    @Override
    @Transactional
    public Delivery markDelivered(String deliveryId, String vendorReferenceId, String payloadEncrypted) {
        Delivery delivery = deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> new IllegalStateException("Delivery " + deliveryId + " not found"));

        delivery.markDelivered(vendorReferenceId, payloadEncrypted);
        deliveryRepository.save(delivery);

        EsimDeliveredEvent event = new EsimDeliveredEvent(
                "1",
                UUID.randomUUID().toString(),
                Instant.now(),
                delivery.getId(),
                delivery.getOrderId(),
                delivery.getOrderName(),
                delivery.getLineItemId(),
                delivery.getCustomerEmail(),
                delivery.getSku(),
                vendorReferenceId
        );

        outboxEventRepository.save(OutboxEvent.newEvent(
                EsimDeliveredEvent.AGGREGATE_TYPE,
                delivery.getId(),
                EsimDeliveredEvent.EVENT_TYPE,
                delivery.getOrderId(), // partition key: one order's events stay ordered
                toJson(event)
        ));

        return delivery;
    }

    @Override
    @Transactional
    public VendorOrderAttempt createVendorOrderAttempt(VendorOrderAttempt attempt) {
        return attemptRepository.save(attempt);
    }

    private String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize outbox payload", e);
        }
    }
}
