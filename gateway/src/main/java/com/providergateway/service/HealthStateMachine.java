package com.providergateway.service;

import com.providergateway.model.HealthState;
import com.providergateway.model.HealthStatus;

import java.time.Instant;

/**
 * Pure transition rules. Any success is healthy with the failure count reset;
 * failures are degraded until the count reaches the threshold, then unhealthy.
 */
public final class HealthStateMachine {

    private HealthStateMachine() {
    }

    public static HealthStatus onSuccess(HealthStatus current, Instant at) {
        return current.toBuilder()
                .state(HealthState.HEALTHY)
                .consecutiveFailures(0)
                .lastCheckAt(at)
                .lastSuccessAt(at)
                .build();
    }

    public static HealthStatus onFailure(HealthStatus current, String error, Instant at, int unhealthyThreshold) {
        int failures = current.getConsecutiveFailures() + 1;
        return current.toBuilder()
                .state(failures >= unhealthyThreshold ? HealthState.UNHEALTHY : HealthState.DEGRADED)
                .consecutiveFailures(failures)
                .lastCheckAt(at)
                .lastError(error)
                .build();
    }
}
