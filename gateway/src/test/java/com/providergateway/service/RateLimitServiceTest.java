package com.providergateway.service;

import com.providergateway.config.GatewayProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitServiceTest {

    private final GatewayProperties properties = new GatewayProperties();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final RateLimitService service = new RateLimitService(properties, meterRegistry);

    @Test
    void limitsEachClientSeparately() {
        properties.getRateLimit().setRequestsPerMinute(2);

        assertThat(service.tryConsume("client-a")).isTrue();
        assertThat(service.tryConsume("client-a")).isTrue();
        assertThat(service.tryConsume("client-a")).isFalse();
        assertThat(service.tryConsume("client-b")).isTrue();

        assertThat(meterRegistry.get("gateway.ratelimit").tag("status", "exceeded").counter().count()).isEqualTo(1.0);
    }

    @Test
    void reportsRemainingAndReset() {
        properties.getRateLimit().setRequestsPerMinute(1);

        RateLimitService.RateLimitInfo fresh = service.getRateLimitInfo("client-a");
        service.tryConsume("client-a");
        RateLimitService.RateLimitInfo exhausted = service.getRateLimitInfo("client-a");

        assertThat(fresh.limit()).isEqualTo(1);
        assertThat(fresh.remaining()).isEqualTo(1);
        assertThat(fresh.resetSeconds()).isZero();
        assertThat(exhausted.remaining()).isZero();
        assertThat(exhausted.resetSeconds()).isBetween(1, 61);
    }

    @Test
    void resetGivesTheClientAFreshBucket() {
        properties.getRateLimit().setRequestsPerMinute(1);
        service.tryConsume("client-a");

        assertThat(service.resetLimit("client-a")).isTrue();
        assertThat(service.tryConsume("client-a")).isTrue();
        assertThat(service.resetLimit("never-seen")).isFalse();
    }

    @Test
    void blankIdentifierSharesTheAnonymousBucket() {
        properties.getRateLimit().setRequestsPerMinute(1);

        assertThat(service.tryConsume(null)).isTrue();
        assertThat(service.tryConsume(RateLimitService.ANONYMOUS)).isFalse();
    }

    @Test
    void disabledLimiterAllowsEverything() {
        properties.getRateLimit().setEnabled(false);
        properties.getRateLimit().setRequestsPerMinute(1);

        for (int i = 0; i < 10; i++) {
            assertThat(service.tryConsume("client-a")).isTrue();
        }
    }
}
