package com.github.dimitryivaniuta.gateway.esim.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/**
 * Jackson configuration.
 *
 * <p>One "canonical" ObjectMapper serves HTTP, job payloads and stored activation payloads. Properties
 * and map entries are sorted so the same canonical payload always serializes to the same bytes.</p>
 */
@Configuration
public class JacksonConfig {

    /**
     * Canonical ObjectMapper.
     *
     * @param builder Boot-configured builder (unknown properties are ignored)
     * @return canonical mapper
     */
    @Bean("canonicalObjectMapper")
    public ObjectMapper canonicalObjectMapper(Jackson2ObjectMapperBuilder builder) {
        return configure(builder);
    }

    /**
     * Applies the canonical settings to a builder; shared with tests that run without a context.
     *
     * @param builder builder
     * @return mapper
     */
    public static ObjectMapper configure(Jackson2ObjectMapperBuilder builder) {
        ObjectMapper om = builder.createXmlMapper(false)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .featuresToEnable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
        om.registerModule(new JavaTimeModule());
        return om;
    }
}
