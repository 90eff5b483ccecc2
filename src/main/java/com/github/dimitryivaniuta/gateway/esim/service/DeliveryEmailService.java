package com.github.dimitryivaniuta.gateway.esim.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.esim.domain.Delivery;
import com.github.dimitryivaniuta.gateway.esim.domain.DeliveryAttempt;
import com.github.dimitryivaniuta.gateway.esim.repo.DeliveryAttemptRepository;
import com.github.dimitryivaniuta.gateway.esim.repo.DeliveryRepository;
import com.github.dimitryivaniuta.gateway.esim.service.dto.DeliveryEmailRequest;
import com.github.dimitryivaniuta.gateway.esim.service.dto.DeliveryEmailResult;
import com.github.dimitryivaniuta.gateway.esim.service.dto.SkuMappingView;
import com.github.dimitryivaniuta.gateway.esim.service.events.EsimDeliveredEvent;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.CanonicalEsimPayload;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Emails the activation data of a delivered eSIM to the customer, once.
 *
 * <p>A SENT email attempt for the delivery makes redelivered events no-ops. Every send, successful or
 * not, is recorded as a {@link DeliveryAttempt}.</p>
 */
@Slf4j
@Service
public class DeliveryEmailService {

    private final DeliveryRepository deliveryRepository;
    private final DeliveryAttemptRepository attemptRepository;
    private final SkuMappingLookup skuMappingLookup;
    private final SecretVault vault;
    private final DeliveryEmailSender sender;
    private final ObjectMapper objectMapper;

    private final Counter sentCounter;
    private final Counter failedCounter;

    public DeliveryEmailService(
            DeliveryRepository deliveryRepository,
            DeliveryAttemptRepository attemptRepository,
            SkuMappingLookup skuMappingLookup,
            SecretVault vault,
            DeliveryEmailSender sender,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry
    ) {
        this.deliveryRepository = deliveryRepository;
        this.attemptRepository = attemptRepository;
        this.skuMappingLookup = skuMappingLookup;
        this.vault = vault;
        this.sender = sender;
        this.objectMapper = objectMapper;

        this.sentCounter = Counter.builder("esim.email.sent").register(meterRegistry);
        this.failedCounter = Counter.builder("esim.email.failed").register(meterRegistry);
    }

    /**
     * Handles one {@code EsimDelivered} event.
     *
     * @param event event
     * @throws DeliveryEmailException if the sender rejected the email
     */
    public void handle(EsimDeliveredEvent event) {
        String deliveryId = event.deliveryId();

        if (attemptRepository.existsByDeliveryIdAndChannelAndResult(
                deliveryId, DeliveryAttempt.CHANNEL_EMAIL, DeliveryAttempt.RESULT_SENT)) {
            log.info("Delivery email for {} already sent, skipping", deliveryId);
            return;
        }

        Delivery delivery = deliveryRepository.findById(deliveryId).orElse(null);
        if (delivery == null || !delivery.isDelivered() || delivery.getPayloadEncrypted() == null) {
            log.warn("Delivery {} has no activation data to send, skipping", deliveryId);
            return;
        }
        if (delivery.getCustomerEmail() == null) {
            log.warn("Delivery {} has no customer email, skipping", deliveryId);
            return;
        }

        CanonicalEsimPayload payload = readPayload(vault.decrypt(delivery.getPayloadEncrypted()));
        SkuMappingView product = delivery.getSku() == null ? null : skuMappingLookup.find(delivery.getSku());

        DeliveryEmailRequest request = new DeliveryEmailRequest(
                deliveryId,
                delivery.getCustomerEmail(),
                delivery.getOrderName(),
                product == null ? null : product.name(),
                product == null ? null : product.region(),
                product == null ? null : product.dataAmount(),
                product == null ? null : product.validity(),
                payload.lpa(),
                payload.activationCode(),
                payload.iccid()
        );

        DeliveryEmailResult result;
        try {
            result = sender.sendDeliveryEmail(request);
        } catch (RuntimeException e) {
            result = DeliveryEmailResult.failed(Backoff.errorText(e));
        }

        if (result.success()) {
            attemptRepository.save(DeliveryAttempt.sent(deliveryId, DeliveryAttempt.CHANNEL_EMAIL, result.messageId()));
            sentCounter.increment();
            log.info("Delivery email sent for {} ({}). messageId={}", delivery.getOrderName(), deliveryId, result.messageId());
            return;
        }

        String error = result.error() == null ? "Unknown error" : result.error();
        attemptRepository.save(DeliveryAttempt.failed(deliveryId, DeliveryAttempt.CHANNEL_EMAIL, error));
        failedCounter.increment();
        throw new DeliveryEmailException("Delivery email for " + deliveryId + " failed: " + error);
    }

    private CanonicalEsimPayload readPayload(String json) {
        try {
            return objectMapper.readValue(json, CanonicalEsimPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored activation payload is not valid JSON", e);
        }
    }
}
