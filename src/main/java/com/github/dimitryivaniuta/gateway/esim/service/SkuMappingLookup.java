package com.github.dimitryivaniuta.gateway.esim.service;

import com.github.dimitryivaniuta.gateway.esim.config.CacheConfig;
import com.github.dimitryivaniuta.gateway.esim.repo.ProviderSkuMappingRepository;
import com.github.dimitryivaniuta.gateway.esim.service.dto.SkuMappingView;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only lookup of storefront SKU to vendor SKU mappings, cached in Redis.
 */
@Service
public class SkuMappingLookup {

    private final ProviderSkuMappingRepository repository;

    public SkuMappingLookup(ProviderSkuMappingRepository repository) {
        this.repository = repository;
    }

    /**
     * Finds the mapping for a storefront SKU. Misses are not cached, so a mapping added later is picked
     * up on the next job retry.
     *
     * @param shopifySku storefront SKU
     * @return mapping or null
     */
    @Cacheable(cacheNames = CacheConfig.SKU_MAPPING_CACHE, key = "#shopifySku", unless = "#result == null")
    @Transactional(readOnly = true)
    public SkuMappingView find(String shopifySku) {
        return repository.findByShopifySku(shopifySku)
                .map(SkuMappingView::from)
                .orElse(null);
    }
}
