package com.providergateway.model;

import lombok.Builder;
import lombok.Value;

/**
 * Canonical full completion, identical in shape whichever adapter produced it.
 */
@Value
@Builder(toBuilder = true)
public class NormalizedResult {
    String id;
    String model;
    String nativeModel;

    @Builder.Default
    String role = "assistant";

    String content;
    String finishReason;

    /**
     * Present only when the upstream reported token counts.
     */
    ChatModels.Usage usage;

    long latencyMs;
    String providerId;
    String providerSlug;
    int retryCount;
    boolean cached;
}
