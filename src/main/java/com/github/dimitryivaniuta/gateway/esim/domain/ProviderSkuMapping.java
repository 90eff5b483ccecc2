package com.github.dimitryivaniuta.gateway.esim.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Storefront SKU to vendor product mapping.
 *
 * <p>Maintained by catalog tooling outside this service; read-only here. {@code providerSku} has the
 * form {@code skuId:priceId}, e.g. {@code 26:392-1-1-300-M}.</p>
 */
@Entity
@Table(
        name = "provider_sku_mappings",
        indexes = {
                @Index(name = "idx_sku_mapping_shopify_sku", columnList = "shopify_sku", unique = true),
                @Index(name = "idx_sku_mapping_provider", columnList = "provider")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class ProviderSkuMapping {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "shopify_sku", nullable = false, length = 128)
    private String shopifySku;

    @Column(name = "provider", nullable = false, length = 32)
    private String provider;

    @Column(name = "provider_sku", nullable = false, length = 128)
    private String providerSku;

    @Column(name = "name", length = 255)
    private String name;

    @Column(name = "region", length = 128)
    private String region;

    @Column(name = "data_amount", length = 64)
    private String dataAmount;

    @Column(name = "validity", length = 64)
    private String validity;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "package_type", length = 16)
    private PackageType packageType = PackageType.FIXED;

    @Column(name = "days_count")
    private Integer daysCount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();
}
