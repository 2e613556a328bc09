package com.providergateway.model;

import com.providergateway.error.ErrorKind;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one adapter health check, before it is attributed to a provider.
 */
@Value
@Builder
public class HealthProbeResult {
    boolean success;
    long latencyMs;
    String requestSnapshot;
    String responseSnapshot;
    ErrorKind errorKind;
    String errorMessage;

    public static HealthProbeResult failure(ErrorKind kind, String message, String requestSnapshot, long latencyMs) {
        return HealthProbeResult.builder()
                .success(false)
                .errorKind(kind)
                .errorMessage(message)
                .requestSnapshot(requestSnapshot)
                .latencyMs(latencyMs)
                .build();
    }
}
