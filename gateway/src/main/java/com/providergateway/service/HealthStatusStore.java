package com.providergateway.service;

import com.providergateway.model.HealthStatus;
import reactor.core.publisher.Mono;

public interface HealthStatusStore {

    Mono<Void> save(String providerId, HealthStatus status);

    Mono<HealthStatus> load(String providerId);
}
