package com.github.dimitryivaniuta.gateway.esim.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.esim.domain.Delivery;
import com.github.dimitryivaniuta.gateway.esim.repo.DeliveryRepository;
import com.github.dimitryivaniuta.gateway.esim.vendor.FiRoamClient;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.CancelResult;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.CanonicalEsimPayload;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.ErrorResponseException;

/**
 * Support operations on deliveries: inspection and vendor-side cancellation.
 */
@Slf4j
@Service
public class DeliveryOperationsService {

    private final DeliveryRepository deliveryRepository;
    private final FiRoamClient vendorClient;
    private final SecretVault vault;
    private final ObjectMapper objectMapper;

    public DeliveryOperationsService(
            DeliveryRepository deliveryRepository,
            FiRoamClient vendorClient,
            SecretVault vault,
            ObjectMapper objectMapper
    ) {
        this.deliveryRepository = deliveryRepository;
        this.vendorClient = vendorClient;
        this.vault = vault;
        this.objectMapper = objectMapper;
    }

    @Transactional(readOnly = true)
    public Delivery get(String deliveryId) {
        return deliveryRepository.findById(deliveryId).orElseThrow(() -> notFound(deliveryId));
    }

    @Transactional(readOnly = true)
    public List<Delivery> listByOrder(String orderId) {
        return deliveryRepository.findByOrderIdOrderByCreatedAtAsc(orderId);
    }

    /**
     * Asks the vendor to refund the eSIM of a delivered delivery. The delivery itself is not changed;
     * the vendor's answer is returned as is.
     *
     * @param deliveryId delivery id
     * @return vendor result
     */
    public CancelResult cancel(String deliveryId) {
        Delivery delivery = get(deliveryId);
        if (!delivery.isDelivered() || delivery.getVendorReferenceId() == null) {
            throw conflict("Delivery " + deliveryId + " is " + delivery.getStatus() + "; only delivered eSIMs can be cancelled");
        }

        CanonicalEsimPayload payload = readPayload(vault.decrypt(delivery.getPayloadEncrypted()));
        if (payload.iccid() == null || payload.iccid().isBlank()) {
            throw conflict("Delivery " + deliveryId + " has no ICCID to cancel");
        }

        CancelResult result = vendorClient.cancelOrder(delivery.getVendorReferenceId(), payload.iccid());
        log.info("Cancellation of delivery {} (vendor order {}) success={} code={}",
                deliveryId, delivery.getVendorReferenceId(), result.success(), result.code());
        return result;
    }

    private CanonicalEsimPayload readPayload(String json) {
        try {
            return objectMapper.readValue(json, CanonicalEsimPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored activation payload is not valid JSON", e);
        }
    }

    private static ErrorResponseException notFound(String deliveryId) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, "Delivery '" + deliveryId + "' not found.");
        return new ErrorResponseException(HttpStatus.NOT_FOUND, pd, null);
    }

    private static ErrorResponseException conflict(String detail) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, detail);
        return new ErrorResponseException(HttpStatus.CONFLICT, pd, null);
    }
}
