package com.providergateway.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.providergateway.model.HealthStatus;
import com.providergateway.model.ModelMapping;
import com.providergateway.model.Provider;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Admin rendering of a provider. Environment and header values are masked.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderView(String id, String name, String slug, String type, boolean enabled,
                           boolean pendingRemoval, Map<String, Object> config, List<ModelMapping> models,
                           HealthStatus health, Instant createdAt, Instant updatedAt, Instant enabledAt) {

    static final String MASK = "****";

    private static final Set<String> MASKED_SECTIONS = Set.of("environment", "headers");

    private static final TypeReference<Map<String, Object>> CONFIG_TYPE = new TypeReference<>() {
    };

    static ProviderView from(Provider provider, HealthStatus health, boolean pendingRemoval, ObjectMapper objectMapper) {
        Map<String, Object> config = new LinkedHashMap<>(objectMapper.convertValue(provider.getAdapterConfig(), CONFIG_TYPE));
        for (String section : MASKED_SECTIONS) {
            Object value = config.get(section);
            if (value instanceof Map) {
                Map<String, Object> masked = new LinkedHashMap<>();
                ((Map<?, ?>) value).keySet().forEach(key -> masked.put(String.valueOf(key), MASK));
                config.put(section, masked);
            }
        }
        return new ProviderView(provider.getId(), provider.getName(), provider.getSlug(),
                provider.getType().getWireName(), provider.isEnabled(), pendingRemoval, config,
                provider.getModels(), health, provider.getCreatedAt(), provider.getUpdatedAt(), provider.getEnabledAt());
    }
}
