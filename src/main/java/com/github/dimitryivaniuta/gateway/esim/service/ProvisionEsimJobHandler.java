package com.github.dimitryivaniuta.gateway.esim.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.esim.domain.Delivery;
import com.github.dimitryivaniuta.gateway.esim.domain.ProvisioningJob;
import com.github.dimitryivaniuta.gateway.esim.service.dto.ProvisionJobPayload;
import com.github.dimitryivaniuta.gateway.esim.vendor.CardPayloadNormalizer;
import com.github.dimitryivaniuta.gateway.esim.vendor.FiRoamClient;
import com.github.dimitryivaniuta.gateway.esim.vendor.VendorResponses;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.AddEsimOrderRequest;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.OrderResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Provisions the eSIM of one delivery.
 *
 * <p>Idempotent under redelivery: a DELIVERED delivery is left untouched. Any failure after the
 * delivery was found leaves it FAILED with the reason in {@code lastError} and is rethrown as
 * {@link ProvisioningFailedException} so the queue retries the job.</p>
 */
@Slf4j
@Component
public class ProvisionEsimJobHandler {

    private final DeliveryStore store;
    private final FiRoamClient vendorClient;
    private final OrderPayloadFactory orderPayloadFactory;
    private final SecretVault vault;
    private final ObjectMapper objectMapper;

    public ProvisionEsimJobHandler(
            DeliveryStore store,
            FiRoamClient vendorClient,
            OrderPayloadFactory orderPayloadFactory,
            SecretVault vault,
            ObjectMapper objectMapper
    ) {
        this.store = store;
        this.vendorClient = vendorClient;
        this.orderPayloadFactory = orderPayloadFactory;
        this.vault = vault;
        this.objectMapper = objectMapper;
    }

    /**
     * Runs one attempt.
     *
     * @param job claimed job
     * @throws ProvisioningFailedException if the attempt did not deliver
     */
    public void handle(ProvisioningJob job) {
        ProvisionJobPayload payload = readPayload(job);
        String deliveryId = payload.deliveryId() != null ? payload.deliveryId() : job.getDeliveryId();
        if (deliveryId == null || deliveryId.isBlank()) {
            throw new ProvisioningFailedException("missing deliveryId");
        }

        Delivery delivery = store.findDelivery(deliveryId)
                .orElseThrow(() -> new ProvisioningFailedException("EsimDelivery " + deliveryId + " not found"));

        if (delivery.isDelivered()) {
            log.info("Delivery {} already delivered, nothing to do", deliveryId);
            return;
        }

        delivery.markProvisioning();
        store.updateDelivery(delivery);
        log.info("Provisioning delivery {} for order {} (attempt {})", deliveryId, delivery.getOrderName(), job.getAttemptCount());

        try {
            AddEsimOrderRequest request = orderPayloadFactory.build(payload, delivery);
            OrderResult result = vendorClient.placeOrder(request, deliveryId);

            if (!result.hasCanonical()) {
                throw new ProvisioningFailedException(describeFailure(result));
            }

            String vendorOrderNum = CardPayloadNormalizer.orderNumber(result.raw())
                    .orElse(result.canonical().vendorId());
            String payloadEncrypted = vault.encrypt(toJson(result.canonical()));
            store.markDelivered(deliveryId, vendorOrderNum, payloadEncrypted);

            log.info("eSIM provisioned for delivery {}. vendorOrder={}", deliveryId, vendorOrderNum);
        } catch (RuntimeException e) {
            String msg = Backoff.errorText(e);
            log.warn("Provisioning failed for delivery {}: {}", deliveryId, msg);
            delivery.markFailed(msg);
            store.updateDelivery(delivery);
            if (e instanceof ProvisioningFailedException pfe) {
                throw pfe;
            }
            throw new ProvisioningFailedException(msg, e);
        }
    }

    private static String describeFailure(OrderResult result) {
        if (result.error() != null) {
            return "FiRoam error: " + result.error();
        }
        if (!VendorResponses.isSuccess(result.raw())) {
            return "FiRoam error: " + VendorResponses.describeFailure(result.raw());
        }
        return "FiRoam returned unexpected response";
    }

    private ProvisionJobPayload readPayload(ProvisioningJob job) {
        try {
            return objectMapper.readValue(job.getPayload(), ProvisionJobPayload.class);
        } catch (JsonProcessingException e) {
            throw new ProvisioningFailedException("Unreadable payload of job " + job.getId(), e);
        }
    }

    private String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize canonical payload", e);
        }
    }
}
