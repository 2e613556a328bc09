package com.providergateway.service;

import com.providergateway.model.ChatModels;
import com.providergateway.model.GenerationParameters;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One inbound completion call as the dispatcher sees it.
 */
@Value
@Builder(toBuilder = true)
public class DispatchRequest {
    String requestId;
    String model;

    @Singular
    List<ChatModels.Message> messages;

    @Builder.Default
    GenerationParameters parameters = GenerationParameters.DEFAULTS;

    /**
     * Caller budget in seconds; {@code null} uses the configured default.
     */
    Integer timeoutSeconds;

    @Builder.Default
    Instant receivedAt = Instant.now();

    /**
     * Inbound headers, names lower-cased.
     */
    @Singular
    Map<String, String> forwardedHeaders;

    Map<String, Object> rawBody;

    @Singular("excludedProvider")
    Set<String> excludedProviders;

    public DispatchRequest excluding(String providerId) {
        Set<String> excluded = new HashSet<>(excludedProviders);
        excluded.add(providerId);
        return toBuilder().clearExcludedProviders().excludedProviders(excluded).build();
    }
}
