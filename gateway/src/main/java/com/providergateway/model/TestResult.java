package com.providergateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.providergateway.error.ErrorKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TestResult {
    String providerId;
    ProbeTrigger trigger;
    boolean success;
    long latencyMs;
    String requestSnapshot;
    String responseSnapshot;
    ErrorKind errorKind;
    String errorMessage;
    Instant timestamp;

    public static TestResult from(String providerId, ProbeTrigger trigger, HealthProbeResult probe, Instant at) {
        return TestResult.builder()
                .providerId(providerId)
                .trigger(trigger)
                .success(probe.isSuccess())
                .latencyMs(probe.getLatencyMs())
                .requestSnapshot(probe.getRequestSnapshot())
                .responseSnapshot(probe.getResponseSnapshot())
                .errorKind(probe.getErrorKind())
                .errorMessage(probe.getErrorMessage())
                .timestamp(at)
                .build();
    }
}
