package com.providergateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.providergateway.model.HealthState;
import com.providergateway.model.HealthStatus;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Health snapshots as JSON strings under {@code gateway:health:<provider id>}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedisHealthStatusStore implements HealthStatusStore {

    private static final String KEY_PREFIX = "gateway:health:";

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> save(String providerId, HealthStatus status) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(new StoredStatus(status)))
                .flatMap(json -> redisTemplate.opsForValue().set(KEY_PREFIX + providerId, json))
                .doOnNext(saved -> log.debug("Persisted health of {}: {}", providerId, status.getState()))
                .then();
    }

    @Override
    public Mono<HealthStatus> load(String providerId) {
        return redisTemplate.opsForValue().get(KEY_PREFIX + providerId)
                .flatMap(json -> {
                    try {
                        return Mono.just(objectMapper.readValue(json, StoredStatus.class).toStatus());
                    } catch (JsonProcessingException e) {
                        log.warn("Discarding unreadable health snapshot of {}: {}", providerId, e.getOriginalMessage());
                        return Mono.empty();
                    }
                });
    }

    @Data
    @NoArgsConstructor
    static class StoredStatus {
        private HealthState state;
        private Instant lastCheckAt;
        private Instant lastSuccessAt;
        private int consecutiveFailures;
        private String lastError;

        StoredStatus(HealthStatus status) {
            this.state = status.getState();
            this.lastCheckAt = status.getLastCheckAt();
            this.lastSuccessAt = status.getLastSuccessAt();
            this.consecutiveFailures = status.getConsecutiveFailures();
            this.lastError = status.getLastError();
        }

        HealthStatus toStatus() {
            return HealthStatus.builder()
                    .state(state)
                    .lastCheckAt(lastCheckAt)
                    .lastSuccessAt(lastSuccessAt)
                    .consecutiveFailures(consecutiveFailures)
                    .lastError(lastError)
                    .build();
        }
    }
}
