package com.providergateway.adapter;

import com.providergateway.model.AdapterType;
import com.providergateway.model.HealthProbeResult;
import com.providergateway.model.NormalizedResult;
import com.providergateway.model.StreamChunk;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Uniform contract over the four provider integration styles. One instance is
 * bound to one provider.
 */
public interface ProviderAdapter {

    AdapterType getType();

    /**
     * Full completion. Fails with a {@link com.providergateway.error.GatewayException}
     * of kind {@code TIMEOUT} once the request deadline passes.
     */
    Mono<NormalizedResult> invoke(AdapterRequest request);

    /**
     * Lazy, single-use chunk sequence ending in exactly one terminal chunk or an
     * error signal. Cancelling the subscription releases the process or connection.
     */
    Flux<StreamChunk> invokeStreaming(AdapterRequest request);

    /**
     * Light-weight liveness call. Never errors; failures are reported in the result.
     */
    Mono<HealthProbeResult> healthCheck(Instant deadline);

    /**
     * Releases pooled resources when the provider is removed or replaced.
     */
    default void close() {
    }
}
