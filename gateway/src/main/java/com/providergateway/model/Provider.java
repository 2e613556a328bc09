package com.providergateway.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A configured upstream service. Instances are immutable; registry updates swap
 * whole records so readers never observe a half-applied edit.
 */
@Value
@Builder(toBuilder = true)
public class Provider {

    String id;
    String name;
    String slug;
    boolean enabled;
    AdapterConfig adapterConfig;

    @Singular
    List<ModelMapping> models;

    Instant createdAt;
    Instant updatedAt;

    /**
     * When the provider last went from disabled to enabled; drives the
     * most-recently-enabled conflict tie-break.
     */
    Instant enabledAt;

    public AdapterType getType() {
        return adapterConfig.type();
    }

    public Optional<ModelMapping> findMapping(String externalModelId) {
        return models.stream()
                .filter(mapping -> mapping.getExternalId().equals(externalModelId))
                .findFirst();
    }

    public boolean isDispatchEligible() {
        return enabled && !models.isEmpty();
    }
}
