package com.providergateway.service;

import com.providergateway.adapter.AdapterRequest;
import com.providergateway.adapter.ErrorClassifier;
import com.providergateway.config.GatewayProperties;
import com.providergateway.error.ErrorKind;
import com.providergateway.error.GatewayException;
import com.providergateway.model.NormalizedResult;
import com.providergateway.model.Provider;
import com.providergateway.model.StreamChunk;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Resolves a model to exactly one provider and performs a single attempt
 * against it. Retrying against another provider is the caller's decision.
 */
@Slf4j
@Service
public class Dispatcher {

    private final ProviderRegistry registry;
    private final HealthMonitor healthMonitor;
    private final GatewayProperties.DispatchSettings settings;
    private final MeterRegistry meterRegistry;
    private final GatewayEventLogger events;
    private final Clock clock;

    @Autowired
    public Dispatcher(ProviderRegistry registry, HealthMonitor healthMonitor, GatewayProperties properties,
                      MeterRegistry meterRegistry, GatewayEventLogger events) {
        this(registry, healthMonitor, properties.getDispatch(), meterRegistry, events, Clock.systemUTC());
    }

    Dispatcher(ProviderRegistry registry, HealthMonitor healthMonitor, GatewayProperties.DispatchSettings settings,
               MeterRegistry meterRegistry, GatewayEventLogger events, Clock clock) {
        this.registry = registry;
        this.healthMonitor = healthMonitor;
        this.settings = settings;
        this.meterRegistry = meterRegistry;
        this.events = events;
        this.clock = clock;
    }

    public Mono<NormalizedResult> dispatch(DispatchRequest request) {
        return Mono.defer(() -> {
            Route route = route(request);
            Provider provider = route.candidate().provider();
            long started = System.nanoTime();

            return Mono.using(() -> registry.acquire(provider.getId()),
                            lease -> lease.getAdapter().invoke(route.adapterRequest()),
                            ProviderRegistry.Lease::release)
                    .map(result -> result.toBuilder()
                            .model(request.getModel())
                            .nativeModel(route.candidate().mapping().getNativeId())
                            .providerId(provider.getId())
                            .providerSlug(provider.getSlug())
                            .build())
                    .onErrorMap(error -> ErrorClassifier.classify(error, provider.getSlug())
                            .withContext(provider.getId(), request.getRequestId()))
                    .doOnSuccess(result -> {
                        healthMonitor.recordOutcome(provider.getId(), null, null);
                        count(provider, "success", false);
                        events.info("request_completed", provider.getId(), request.getRequestId(), Map.of(
                                "model", request.getModel(),
                                "latencyMs", Duration.ofNanos(System.nanoTime() - started).toMillis()));
                    })
                    .doOnError(GatewayException.class, error -> onFailure(provider, request, error, false));
        });
    }

    /**
     * Routing failures surface on the outer {@code Mono}; once it emits, every
     * problem arrives as an error chunk or error signal on the inner stream.
     */
    public Mono<Flux<StreamChunk>> dispatchStreaming(DispatchRequest request) {
        return Mono.fromCallable(() -> route(request)).map(route -> {
            Provider provider = route.candidate().provider();
            return Flux.using(() -> registry.acquire(provider.getId()),
                            lease -> lease.getAdapter().invokeStreaming(route.adapterRequest()),
                            ProviderRegistry.Lease::release)
                    .onErrorMap(error -> ErrorClassifier.classify(error, provider.getSlug())
                            .withContext(provider.getId(), request.getRequestId()))
                    .doOnNext(chunk -> {
                        if (!chunk.isTerminal()) {
                            return;
                        }
                        if (chunk.isError()) {
                            healthMonitor.recordOutcome(provider.getId(), chunk.getErrorKind(), chunk.getErrorMessage());
                            count(provider, chunk.getErrorKind().getCode(), true);
                        } else {
                            healthMonitor.recordOutcome(provider.getId(), null, null);
                            count(provider, "success", true);
                        }
                    })
                    .doOnError(GatewayException.class, error -> onFailure(provider, request, error, true));
        });
    }

    private void onFailure(Provider provider, DispatchRequest request, GatewayException error, boolean stream) {
        healthMonitor.recordOutcome(provider.getId(), error.getKind(), error.getMessage());
        count(provider, error.getKind().getCode(), stream);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("model", request.getModel());
        fields.put("kind", error.getKind().getCode());
        fields.put("detail", error.getMessage());
        events.warn("request_failed", provider.getId(), request.getRequestId(), fields);
    }

    private Route route(DispatchRequest request) {
        List<ProviderRegistry.Candidate> candidates = registry.findCandidates(request.getModel());
        if (candidates.isEmpty()) {
            throw new GatewayException(ErrorKind.NOT_FOUND, "No enabled provider maps model " + request.getModel(),
                    "The model '" + request.getModel() + "' does not exist or has no enabled provider",
                    null, request.getRequestId(), null);
        }

        List<ProviderRegistry.Candidate> usable = candidates.stream()
                .filter(candidate -> !request.getExcludedProviders().contains(candidate.provider().getId()))
                .filter(candidate -> healthMonitor.isRoutable(candidate.provider().getId()))
                .collect(Collectors.toList());
        if (usable.isEmpty()) {
            throw new GatewayException(ErrorKind.ALL_PROVIDERS_UNHEALTHY,
                    candidates.size() + " provider(s) map " + request.getModel() + " but none is routable",
                    null, null, request.getRequestId(), null);
        }

        ProviderRegistry.Candidate chosen = usable.size() == 1 ? usable.get(0) : resolveConflict(request, usable);
        Instant deadline = deadline(request, chosen.provider());
        if (!deadline.isAfter(clock.instant())) {
            throw new GatewayException(ErrorKind.TIMEOUT, "Deadline already passed before dispatch",
                    null, chosen.provider().getId(), request.getRequestId(), null);
        }

        AdapterRequest adapterRequest = AdapterRequest.builder()
                .requestId(request.getRequestId())
                .externalModelId(request.getModel())
                .nativeModelId(chosen.mapping().getNativeId())
                .messages(request.getMessages())
                .parameters(request.getParameters())
                .deadline(deadline)
                .forwardedHeaders(request.getForwardedHeaders())
                .rawBody(request.getRawBody())
                .build();
        log.debug("Routing {} for request {} to {}", request.getModel(), request.getRequestId(), chosen.provider().getSlug());
        return new Route(chosen, adapterRequest);
    }

    private ProviderRegistry.Candidate resolveConflict(DispatchRequest request, List<ProviderRegistry.Candidate> usable) {
        String slugs = usable.stream().map(candidate -> candidate.provider().getSlug()).collect(Collectors.joining(", "));
        if (settings.getConflictPolicy() == GatewayProperties.ConflictPolicy.REJECT) {
            throw new GatewayException(ErrorKind.CONFIGURATION_INVALID,
                    "Model " + request.getModel() + " is mapped by several providers: " + slugs,
                    null, null, request.getRequestId(), null);
        }
        ProviderRegistry.Candidate chosen = usable.stream()
                .max(Comparator.comparing(candidate -> candidate.provider().getEnabledAt(),
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .orElseThrow();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("model", request.getModel());
        fields.put("providers", slugs);
        fields.put("chosen", chosen.provider().getSlug());
        events.warn("configuration_conflict", chosen.provider().getId(), request.getRequestId(), fields);
        return chosen;
    }

    /**
     * The tighter of the caller budget and the provider's own timeout, measured
     * from arrival and shortened by the safety margin.
     */
    Instant deadline(DispatchRequest request, Provider provider) {
        int budget = request.getTimeoutSeconds() != null && request.getTimeoutSeconds() > 0
                ? request.getTimeoutSeconds()
                : settings.getDefaultTimeoutSeconds();
        int providerTimeout = provider.getAdapterConfig().getTimeoutSeconds();
        if (providerTimeout > 0) {
            budget = Math.min(budget, providerTimeout);
        }
        Instant start = request.getReceivedAt() != null ? request.getReceivedAt() : clock.instant();
        return start.plusSeconds(budget).minusMillis(settings.getSafetyMarginMillis());
    }

    private void count(Provider provider, String status, boolean stream) {
        meterRegistry.counter("gateway.requests",
                "provider", provider.getSlug(),
                "status", status,
                "stream", String.valueOf(stream)).increment();
    }

    private record Route(ProviderRegistry.Candidate candidate, AdapterRequest adapterRequest) {
    }
}
