package com.providergateway.adapter;

import com.providergateway.model.AdapterType;
import com.providergateway.model.LocalConfig;
import com.providergateway.model.Provider;
import com.providergateway.service.ResponseNormalizer;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Co-located inference server, either OpenAI-compatible or Ollama's native API.
 * A bulkhead caps in-flight calls; callers wait up to the queue timeout for a
 * slot and then fail as overloaded.
 */
@Slf4j
public class LocalAdapter extends AbstractHttpAdapter {

    private final LocalConfig config;
    private final BulkheadRegistry bulkheadRegistry;
    private final Bulkhead bulkhead;

    public LocalAdapter(Provider provider, WebClient webClient, BulkheadRegistry bulkheadRegistry,
                        ResponseNormalizer normalizer, MeterRegistry meterRegistry) {
        super(provider, webClient, normalizer, meterRegistry);
        this.config = (LocalConfig) provider.getAdapterConfig();
        this.bulkheadRegistry = bulkheadRegistry;
        // One bulkhead per adapter instance; a config update must not inherit the old limits.
        this.bulkhead = bulkheadRegistry.bulkhead("local-" + provider.getSlug() + "-" + UUID.randomUUID(),
                BulkheadConfig.custom()
                        .maxConcurrentCalls(config.getMaxConcurrentRequests())
                        .maxWaitDuration(Duration.ofMillis(config.getQueueTimeoutMillis()))
                        .build());
    }

    Bulkhead getBulkhead() {
        return bulkhead;
    }

    @Override
    public AdapterType getType() {
        return AdapterType.LOCAL;
    }

    @Override
    protected String chatPath() {
        return config.effectiveChatPath();
    }

    @Override
    protected String healthPath() {
        return config.effectiveHealthPath();
    }

    @Override
    protected Map<String, Object> buildBody(AdapterRequest request, boolean stream) {
        if (config.getProtocol() != LocalConfig.Protocol.OLLAMA) {
            return openAiBody(request.getNativeModelId(), request, stream);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", ollamaModel(request.getNativeModelId()));
        body.put("messages", request.getMessages());
        body.put("stream", stream);
        Map<String, Object> options = new LinkedHashMap<>();
        var parameters = request.getParameters();
        if (parameters.getTemperature() != null) {
            options.put("temperature", parameters.getTemperature());
        }
        if (parameters.getTopP() != null) {
            options.put("top_p", parameters.getTopP());
        }
        if (parameters.getMaxTokens() != null) {
            options.put("num_predict", parameters.getMaxTokens());
        }
        if (parameters.getStop() != null && !parameters.getStop().isEmpty()) {
            options.put("stop", parameters.getStop());
        }
        if (!options.isEmpty()) {
            body.put("options", options);
        }
        return body;
    }

    static String ollamaModel(String nativeModelId) {
        return nativeModelId.contains(":") ? nativeModelId : nativeModelId + ":latest";
    }

    @Override
    protected Flux<String> streamPayloads(WebClient.ResponseSpec response) {
        if (config.getProtocol() == LocalConfig.Protocol.OLLAMA) {
            // NDJSON; the string decoder splits on newlines.
            return response.bodyToFlux(String.class);
        }
        return super.streamPayloads(response);
    }

    @Override
    protected <T> Mono<T> admit(Mono<T> call) {
        return Mono.using(this::acquire, permit -> call, Bulkhead::onComplete)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    protected <T> Flux<T> admit(Flux<T> call) {
        return Flux.using(this::acquire, permit -> call, Bulkhead::onComplete)
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Blocks up to the queue timeout; throws {@code BulkheadFullException} when no slot frees up.
     */
    private Bulkhead acquire() {
        bulkhead.acquirePermission();
        return bulkhead;
    }

    @Override
    public void close() {
        bulkheadRegistry.remove(bulkhead.getName());
        log.debug("Removed bulkhead {}", bulkhead.getName());
    }
}
