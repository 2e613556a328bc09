package com.providergateway.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class HealthStatus {

    public static final HealthStatus INITIAL = HealthStatus.builder().build();

    @Builder.Default
    HealthState state = HealthState.UNKNOWN;

    Instant lastCheckAt;
    Instant lastSuccessAt;
    int consecutiveFailures;
    String lastError;

    public boolean isRoutable() {
        return state != HealthState.UNHEALTHY;
    }
}
