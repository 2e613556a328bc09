package com.providergateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.providergateway.config.GatewayProperties;
import com.providergateway.model.ChatModels;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;

/**
 * Optional Redis cache of full, non-streamed completions keyed on the model,
 * the messages and the generation parameters.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheService {

    static final String CACHE_PREFIX = "gateway:cache:";

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;
    private final MeterRegistry meterRegistry;

    public Mono<ChatModels.ChatResponse> getCachedResponse(ChatModels.ChatRequest request) {
        if (!properties.getCache().isEnabled()) {
            return Mono.empty();
        }

        String cacheKey = generateCacheKey(request);

        return redisTemplate.opsForValue().get(cacheKey)
                .flatMap(cached -> {
                    try {
                        ChatModels.ChatResponse response = objectMapper.readValue(cached, ChatModels.ChatResponse.class);
                        if (response.getGateway() != null) {
                            response.getGateway().setCached(true);
                        } else {
                            response.setGateway(ChatModels.GatewayMetadata.builder()
                                    .cached(true)
                                    .build());
                        }

                        meterRegistry.counter("gateway.cache", "status", "hit").increment();
                        log.debug("Cache hit for key: {}", cacheKey);
                        return Mono.just(response);
                    } catch (JsonProcessingException e) {
                        log.warn("Dropping unreadable cache entry {}: {}", cacheKey, e.getOriginalMessage());
                        return Mono.empty();
                    }
                })
                .onErrorResume(e -> {
                    log.warn("Cache lookup failed: {}", e.getMessage());
                    return Mono.empty();
                })
                .switchIfEmpty(Mono.defer(() -> {
                    meterRegistry.counter("gateway.cache", "status", "miss").increment();
                    return Mono.empty();
                }));
    }

    public Mono<Void> cacheResponse(ChatModels.ChatRequest request, ChatModels.ChatResponse response) {
        if (!properties.getCache().isEnabled()) {
            return Mono.empty();
        }
        if (Boolean.TRUE.equals(request.getStream()) || response.getChoices() == null || response.getChoices().isEmpty()) {
            return Mono.empty();
        }

        String cacheKey = generateCacheKey(request);

        try {
            String serialized = objectMapper.writeValueAsString(response);
            Duration ttl = Duration.ofSeconds(properties.getCache().getTtlSeconds());

            return redisTemplate.opsForValue().set(cacheKey, serialized, ttl)
                    .doOnSuccess(stored -> log.debug("Cached response for key: {}", cacheKey))
                    .onErrorResume(e -> {
                        log.warn("Failed to cache response: {}", e.getMessage());
                        return Mono.empty();
                    })
                    .then();
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize response for caching: {}", e.getOriginalMessage());
            return Mono.empty();
        }
    }

    /**
     * Deletes cache entries whose key suffix matches the glob pattern.
     */
    public Mono<Long> invalidateCache(String pattern) {
        return redisTemplate.keys(CACHE_PREFIX + pattern)
                .flatMap(redisTemplate::delete)
                .reduce(0L, Long::sum);
    }

    String generateCacheKey(ChatModels.ChatRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append(request.getModel()).append('|');
        sb.append(request.getTemperature()).append('|');
        sb.append(request.getMaxTokens()).append('|');
        sb.append(request.getTopP()).append('|');
        sb.append(request.getStop()).append('|');
        if (request.getMessages() != null) {
            for (ChatModels.Message msg : request.getMessages()) {
                sb.append(msg.getRole()).append(':').append(msg.getContent()).append('|');
            }
        }

        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(sb.toString().getBytes(StandardCharsets.UTF_8));
            return CACHE_PREFIX + HexFormat.of().formatHex(hash).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
