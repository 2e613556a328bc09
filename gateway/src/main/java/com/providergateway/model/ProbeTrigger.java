package com.providergateway.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProbeTrigger {
    SCHEDULED,
    MANUAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
