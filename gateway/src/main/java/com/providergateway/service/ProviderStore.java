package com.providergateway.service;

import com.providergateway.model.ProviderDefinition;

import java.util.List;

/**
 * Durable home of provider definitions. The registry loads it once at startup and
 * writes through on every admin change.
 */
public interface ProviderStore {

    List<ProviderDefinition> loadAll();

    void save(ProviderDefinition definition);

    void delete(String providerId);
}
