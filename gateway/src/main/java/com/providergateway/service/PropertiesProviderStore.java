package com.providergateway.service;

import com.providergateway.config.GatewayProperties;
import com.providergateway.model.ProviderDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds from {@code gateway.providers}. Admin changes are kept for the life of
 * the process only.
 */
@Slf4j
@Service
public class PropertiesProviderStore implements ProviderStore {

    private final Map<String, ProviderDefinition> definitions = new LinkedHashMap<>();

    public PropertiesProviderStore(GatewayProperties properties) {
        for (ProviderDefinition definition : properties.getProviders()) {
            String key = definition.getId() != null ? definition.getId() : definition.getSlug();
            definitions.put(key != null ? key : "provider-" + definitions.size(), definition);
        }
    }

    @Override
    public synchronized List<ProviderDefinition> loadAll() {
        return new ArrayList<>(definitions.values());
    }

    @Override
    public synchronized void save(ProviderDefinition definition) {
        definitions.put(definition.getId() != null ? definition.getId() : definition.getSlug(), definition);
        log.debug("Stored provider definition {}", definition.getSlug());
    }

    @Override
    public synchronized void delete(String providerId) {
        definitions.remove(providerId);
    }
}
