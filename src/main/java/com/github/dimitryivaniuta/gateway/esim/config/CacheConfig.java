package com.github.dimitryivaniuta.gateway.esim.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.esim.service.dto.SkuMappingView;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Cache configuration.
 *
 * <p>Redis caches SKU mapping lookups only; Postgres stays the source of truth. Setting
 * {@code spring.cache.type=none} turns caching off (tests do).</p>
 */
@EnableCaching
@Configuration
public class CacheConfig {

    /**
     * Cache name for SKU mapping lookups.
     */
    public static final String SKU_MAPPING_CACHE = "providerSkuMappings";

    /**
     * Cache manager using Redis with JSON serialization.
     *
     * @param factory      redis connection factory
     * @param objectMapper object mapper used for JSON serialization
     * @return cache manager
     */
    @Bean
    @ConditionalOnProperty(name = "spring.cache.type", havingValue = "redis", matchIfMissing = true)
    public RedisCacheManager cacheManager(
            RedisConnectionFactory factory,
            @Qualifier("canonicalObjectMapper") ObjectMapper objectMapper
    ) {
        var typedSerializer = new Jackson2JsonRedisSerializer<>(objectMapper, SkuMappingView.class);

        var defaultCfg = RedisCacheConfiguration.defaultCacheConfig()
                .disableCachingNullValues()
                .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()));

        var skuMappingCfg = defaultCfg
                .entryTtl(Duration.ofMinutes(10))
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(typedSerializer));

        return RedisCacheManager.builder(factory)
                .cacheDefaults(defaultCfg)
                .withCacheConfiguration(SKU_MAPPING_CACHE, skuMappingCfg)
                .build();
    }
}
