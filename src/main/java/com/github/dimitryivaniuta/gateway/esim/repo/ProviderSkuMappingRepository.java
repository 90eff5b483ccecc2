package com.github.dimitryivaniuta.gateway.esim.repo;

import com.github.dimitryivaniuta.gateway.esim.domain.ProviderSkuMapping;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Read-only access to {@link ProviderSkuMapping}.
 */
public interface ProviderSkuMappingRepository extends JpaRepository<ProviderSkuMapping, String> {

    Optional<ProviderSkuMapping> findByShopifySku(String shopifySku);
}
