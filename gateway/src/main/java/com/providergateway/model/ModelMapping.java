package com.providergateway.model;

import lombok.Builder;
import lombok.Value;

/**
 * Binds a model id exposed by the gateway to the id the provider understands.
 */
@Value
@Builder(toBuilder = true)
public class ModelMapping {
    String externalId;
    String nativeId;
    Integer maxTokens;
    Integer contextWindow;
    Double costPerToken;
}
