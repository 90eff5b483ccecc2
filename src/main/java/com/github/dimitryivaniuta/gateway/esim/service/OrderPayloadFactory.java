package com.github.dimitryivaniuta.gateway.esim.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.esim.domain.Delivery;
import com.github.dimitryivaniuta.gateway.esim.domain.PackageType;
import com.github.dimitryivaniuta.gateway.esim.service.dto.ProvisionJobPayload;
import com.github.dimitryivaniuta.gateway.esim.service.dto.SkuMappingView;
import com.github.dimitryivaniuta.gateway.esim.vendor.dto.AddEsimOrderRequest;
import org.springframework.stereotype.Component;

/**
 * Builds the vendor order for a provisioning job.
 *
 * <p>An explicit {@code orderPayload} in the job wins. Otherwise the storefront SKU is looked up and
 * its {@code skuId:priceId} vendor SKU ordered once, asking for card data in the order response.</p>
 */
@Component
public class OrderPayloadFactory {

    static final String SUPPORTED_PROVIDER = "firoam";

    private final SkuMappingLookup skuMappingLookup;
    private final ObjectMapper objectMapper;

    public OrderPayloadFactory(SkuMappingLookup skuMappingLookup, ObjectMapper objectMapper) {
        this.skuMappingLookup = skuMappingLookup;
        this.objectMapper = objectMapper;
    }

    /**
     * @param payload job payload
     * @param delivery delivery being provisioned
     * @return order request
     * @throws ProvisioningFailedException if no orderable mapping exists for the SKU
     */
    public AddEsimOrderRequest build(ProvisionJobPayload payload, Delivery delivery) {
        if (payload.orderPayload() != null && !payload.orderPayload().isEmpty()) {
            return objectMapper.convertValue(payload.orderPayload(), AddEsimOrderRequest.class);
        }

        String sku = payload.sku() != null ? payload.sku() : delivery.getSku();
        if (sku == null || sku.isBlank()) {
            throw new ProvisioningFailedException("Missing SKU in job data");
        }

        SkuMappingView mapping = skuMappingLookup.find(sku);
        if (mapping == null) {
            throw new ProvisioningFailedException("No provider mapping found for SKU: " + sku);
        }
        if (!mapping.active()) {
            throw new ProvisioningFailedException("SKU mapping is inactive: " + sku);
        }
        if (!SUPPORTED_PROVIDER.equals(mapping.provider())) {
            throw new ProvisioningFailedException("Unsupported provider: " + mapping.provider());
        }

        String[] parts = mapping.providerSku() == null ? new String[0] : mapping.providerSku().split(":", -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new ProvisioningFailedException("Invalid providerSku format: " + mapping.providerSku()
                    + ". Expected format: \"skuId:priceId\" (e.g., \"26:392-1-1-300-M\")");
        }

        AddEsimOrderRequest request = AddEsimOrderRequest.of(parts[0], parts[1], "1");
        request.setBackInfo("1");
        request.setCustomerEmail(delivery.getCustomerEmail());
        request.setOtherOrderId(delivery.getOrderId());
        request.setOtherItemId(delivery.getLineItemId());

        if (mapping.packageType() == PackageType.DAYPASS) {
            if (mapping.daysCount() == null || mapping.daysCount() <= 0) {
                throw new ProvisioningFailedException("Daypass mapping without daysCount: " + sku);
            }
            request.setDaypassDays(String.valueOf(mapping.daysCount()));
        }
        return request;
    }
}
