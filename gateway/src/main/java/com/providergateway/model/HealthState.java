package com.providergateway.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthState {
    UNKNOWN,
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
