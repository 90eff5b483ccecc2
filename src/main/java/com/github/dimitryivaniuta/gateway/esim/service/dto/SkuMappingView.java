package com.github.dimitryivaniuta.gateway.esim.service.dto;

import com.github.dimitryivaniuta.gateway.esim.domain.PackageType;
import com.github.dimitryivaniuta.gateway.esim.domain.ProviderSkuMapping;

/**
 * Cacheable read model of a {@link ProviderSkuMapping}.
 *
 * @param shopifySku storefront SKU
 * @param provider vendor name, e.g. {@code firoam}
 * @param providerSku vendor SKU in {@code skuId:priceId} form
 * @param name product name
 * @param region covered region
 * @param dataAmount data allowance, e.g. {@code 5GB}
 * @param validity validity, e.g. {@code 30 days}
 * @param active whether the mapping may be ordered
 * @param packageType fixed or daypass
 * @param daysCount days for daypass packages
 */
public record SkuMappingView(
        String shopifySku,
        String provider,
        String providerSku,
        String name,
        String region,
        String dataAmount,
        String validity,
        boolean active,
        PackageType packageType,
        Integer daysCount
) {

    /**
     * Maps an entity.
     *
     * @param m entity
     * @return view
     */
    public static SkuMappingView from(ProviderSkuMapping m) {
        return new SkuMappingView(
                m.getShopifySku(),
                m.getProvider(),
                m.getProviderSku(),
                m.getName(),
                m.getRegion(),
                m.getDataAmount(),
                m.getValidity(),
                m.isActive(),
                m.getPackageType(),
                m.getDaysCount()
        );
    }
}
