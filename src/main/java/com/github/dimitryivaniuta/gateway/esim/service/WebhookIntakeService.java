package com.github.dimitryivaniuta.gateway.esim.service;

import com.github.dimitryivaniuta.gateway.esim.domain.Delivery;
import com.github.dimitryivaniuta.gateway.esim.service.dto.IntakeResult;
import com.github.dimitryivaniuta.gateway.esim.service.dto.OrderPaidNotification;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Turns a verified {@code orders/paid} notification into deliveries and provisioning jobs.
 *
 * <p>Each line item is registered in its own transaction, so one bad line item does not roll back the
 * others and a redelivered notification only creates what is still missing.</p>
 */
@Slf4j
@Service
public class WebhookIntakeService {

    private final DeliveryIntakeTxService txService;

    private final Counter createdCounter;
    private final Counter duplicateCounter;

    public WebhookIntakeService(DeliveryIntakeTxService txService, MeterRegistry meterRegistry) {
        this.txService = txService;
        this.createdCounter = Counter.builder("esim.deliveries.created").register(meterRegistry);
        this.duplicateCounter = Counter.builder("esim.deliveries.duplicate").register(meterRegistry);
    }

    /**
     * Registers every line item of the order.
     *
     * @param shop shop domain from the notification headers
     * @param notification parsed notification; must carry a customer email
     * @return created and skipped line items
     */
    public IntakeResult accept(String shop, OrderPaidNotification notification) {
        String orderId = notification.id();
        String customerEmail = notification.customerEmail();
        log.info("Received orders/paid for {} ({}) with {} line items",
                notification.name(), orderId, notification.lineItemsOrEmpty().size());

        List<String> created = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (OrderPaidNotification.LineItem item : notification.lineItemsOrEmpty()) {
            Optional<Delivery> delivery;
            try {
                delivery = txService.registerLineItem(
                        shop, orderId, notification.name(), item.id(), item.variantId(), item.sku(), customerEmail);
            } catch (DataIntegrityViolationException e) {
                // a concurrent notification committed the same line item first
                log.info("Line item registered concurrently, skipping. order={} lineItemId={}", notification.name(), item.id());
                delivery = Optional.empty();
            }

            if (delivery.isPresent()) {
                created.add(delivery.get().getId());
                createdCounter.increment();
            } else {
                skipped.add(item.id());
                duplicateCounter.increment();
            }
        }

        return new IntakeResult(created, skipped);
    }
}
