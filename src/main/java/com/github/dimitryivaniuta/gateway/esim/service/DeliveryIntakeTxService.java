package com.github.dimitryivaniuta.gateway.esim.service;

import com.github.dimitryivaniuta.gateway.esim.config.AppProperties;
import com.github.dimitryivaniuta.gateway.esim.domain.Delivery;
import com.github.dimitryivaniuta.gateway.esim.repo.DeliveryRepository;
import com.github.dimitryivaniuta.gateway.esim.service.dto.ProvisionJobPayload;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Registers one order line item for fulfillment in its own transaction.
 *
 * <p>Lives in its own bean so that the call from {@link WebhookIntakeService} goes through the Spring
 * proxy and actually opens a transaction per line item.</p>
 */
@Service
public class DeliveryIntakeTxService {

    private static final Logger log = LoggerFactory.getLogger(DeliveryIntakeTxService.class);

    private final DeliveryRepository deliveryRepository;
    private final JobQueue jobQueue;
    private final PostgresAdvisoryLockService advisoryLockService;
    private final AppProperties properties;

    public DeliveryIntakeTxService(
            DeliveryRepository deliveryRepository,
            JobQueue jobQueue,
            PostgresAdvisoryLockService advisoryLockService,
            AppProperties properties
    ) {
        this.deliveryRepository = deliveryRepository;
        this.jobQueue = jobQueue;
        this.advisoryLockService = advisoryLockService;
        this.properties = properties;
    }

    /**
     * Creates a PENDING delivery and its provisioning job, unless the line item is already known.
     *
     * @param shop shop domain
     * @param orderId order id
     * @param orderName order name
     * @param lineItemId line item id
     * @param variantId variant id
     * @param sku storefront SKU, may be null
     * @param customerEmail customer email
     * @return the new delivery, or empty if the line item was registered before
     */
    @Transactional
    public Optional<Delivery> registerLineItem(String shop, String orderId, String orderName, String lineItemId,
                                               String variantId, String sku, String customerEmail) {
        advisoryLockService.lockLineItem(orderId, lineItemId);

        Optional<Delivery> existing = deliveryRepository.findByOrderIdAndLineItemId(orderId, lineItemId);
        if (existing.isPresent()) {
            log.info("Line item already registered, skipping. order={} lineItemId={} deliveryId={}",
                    orderName, lineItemId, existing.get().getId());
            return Optional.empty();
        }

        Delivery delivery = Delivery.pending(shop, orderId, orderName, lineItemId, variantId, sku, customerEmail);
        // flushed through the repository proxy so a unique-constraint race surfaces as DataIntegrityViolationException
        deliveryRepository.saveAndFlush(delivery);

        jobQueue.enqueue(properties.getQueue().getProvisionJobType(), delivery.getId(), new ProvisionJobPayload(
                delivery.getId(),
                orderId,
                delivery.getOrderName(),
                lineItemId,
                delivery.getVariantId(),
                customerEmail,
                sku,
                null
        ));

        log.info("Registered delivery {} for order={} lineItemId={}", delivery.getId(), orderName, lineItemId);
        return Optional.of(delivery);
    }
}
