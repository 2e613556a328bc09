package com.providergateway.service;

import com.providergateway.config.GatewayProperties;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket per client identifier on the inbound API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimitService {

    static final String ANONYMOUS = "anonymous";

    private final GatewayProperties properties;
    private final MeterRegistry meterRegistry;

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        if (properties.getRateLimit().isEnabled()) {
            log.info("Rate limiting enabled: {} requests/minute", properties.getRateLimit().getRequestsPerMinute());
        }
    }

    public boolean tryConsume(String identifier) {
        if (!properties.getRateLimit().isEnabled()) {
            return true;
        }

        ConsumptionProbe probe = bucket(identifier).tryConsumeAndReturnRemaining(1);
        boolean allowed = probe.isConsumed();
        meterRegistry.counter("gateway.ratelimit", "status", allowed ? "allowed" : "exceeded").increment();
        if (!allowed) {
            log.warn("Rate limit exceeded for client {}", mask(key(identifier)));
        }
        return allowed;
    }

    public RateLimitInfo getRateLimitInfo(String identifier) {
        if (!properties.getRateLimit().isEnabled()) {
            return new RateLimitInfo(Integer.MAX_VALUE, Integer.MAX_VALUE, 0);
        }
        Bucket bucket = bucket(identifier);
        int limit = properties.getRateLimit().getRequestsPerMinute();
        long remaining = bucket.getAvailableTokens();
        long resetSeconds = remaining > 0 ? 0
                : TimeUnit.NANOSECONDS.toSeconds(bucket.estimateAbilityToConsume(1).getNanosToWaitForRefill()) + 1;
        return new RateLimitInfo(limit, (int) Math.max(0, remaining), (int) resetSeconds);
    }

    /**
     * Drops the bucket of one identifier (admin function).
     */
    public boolean resetLimit(String identifier) {
        boolean existed = buckets.remove(key(identifier)) != null;
        log.info("Rate limit reset for client {}", mask(identifier));
        return existed;
    }

    private Bucket bucket(String identifier) {
        return buckets.computeIfAbsent(key(identifier), k -> createBucket(properties.getRateLimit().getRequestsPerMinute()));
    }

    private static String key(String identifier) {
        return identifier != null && !identifier.isBlank() ? identifier : ANONYMOUS;
    }

    private static String mask(String identifier) {
        if (identifier == null || identifier.length() <= 8) {
            return identifier;
        }
        return identifier.substring(0, 4) + "****";
    }

    private Bucket createBucket(int requestsPerMinute) {
        return Bucket.builder()
                .addLimit(Bandwidth.builder()
                        .capacity(requestsPerMinute)
                        .refillGreedy(requestsPerMinute, Duration.ofMinutes(1))
                        .build())
                .build();
    }

    public record RateLimitInfo(int limit, int remaining, int resetSeconds) {
    }
}
