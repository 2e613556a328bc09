package com.providergateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.providergateway.adapter.AdapterFactory;
import com.providergateway.adapter.ProviderAdapter;
import com.providergateway.adapter.auth.ProviderCredentials;
import com.providergateway.adapter.process.DirectProcessLauncher;
import com.providergateway.adapter.process.DockerProcessLauncher;
import com.providergateway.config.GatewayProperties;
import com.providergateway.error.AdapterException;
import com.providergateway.error.ErrorKind;
import com.providergateway.error.GatewayException;
import com.providergateway.model.ChatModels;
import com.providergateway.model.HealthState;
import com.providergateway.model.NormalizedResult;
import com.providergateway.model.ProbeTrigger;
import com.providergateway.model.Provider;
import com.providergateway.model.StreamChunk;
import com.providergateway.support.Definitions;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DispatcherTest {

    private final Map<String, ProviderAdapter> adapters = new HashMap<>();
    private final GatewayProperties.DispatchSettings settings = new GatewayProperties.DispatchSettings();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private ProviderRegistry registry;
    private HealthMonitor healthMonitor;
    private Dispatcher dispatcher;

    @BeforeEach
    void setUp() {
        AdapterFactory factory = mock(AdapterFactory.class);
        when(factory.create(any())).thenAnswer(invocation ->
                adapters.get(invocation.<Provider>getArgument(0).getSlug()));
        wire(factory);
    }

    private void wire(AdapterFactory factory) {
        registry = new ProviderRegistry(factory, new ProviderConfigValidator(),
                new PropertiesProviderStore(new GatewayProperties()));
        HealthStatusStore statusStore = mock(HealthStatusStore.class);
        when(statusStore.save(any(), any())).thenReturn(Mono.empty());
        GatewayProperties.HealthSettings health = new GatewayProperties.HealthSettings();
        health.setProbeTimeoutSeconds(2);
        healthMonitor = new HealthMonitor(registry, statusStore, health, meterRegistry,
                new GatewayEventLogger(), Clock.systemUTC());
        dispatcher = new Dispatcher(registry, healthMonitor, settings, meterRegistry,
                new GatewayEventLogger(), Clock.systemUTC());
    }

    private ProviderAdapter register(String slug, Mono<NormalizedResult> response) {
        ProviderAdapter adapter = mock(ProviderAdapter.class);
        when(adapter.invoke(any())).thenReturn(response);
        adapters.put(slug, adapter);
        registry.register(Definitions.local(slug, "http://localhost:8000"));
        return adapter;
    }

    private static Mono<NormalizedResult> answer(String content) {
        return Mono.fromSupplier(() -> NormalizedResult.builder().id("cmpl-1").content(content).finishReason("stop").build());
    }

    private static DispatchRequest request(String model) {
        return DispatchRequest.builder()
                .requestId("req-" + model)
                .model(model)
                .message(ChatModels.Message.builder().role("user").content("hi").build())
                .build();
    }

    private void markUnhealthy(String providerId) {
        for (int i = 0; i < 3; i++) {
            healthMonitor.recordOutcome(providerId, ErrorKind.UPSTREAM_ERROR, "down");
        }
    }

    @Test
    void unmappedModelIsNotFound() {
        register("alpha", answer("a"));

        StepVerifier.create(dispatcher.dispatch(request("no-such-model")))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(GatewayException.class);
                    assertThat(((GatewayException) error).getKind()).isEqualTo(ErrorKind.NOT_FOUND);
                    assertThat(((GatewayException) error).getRequestId()).isEqualTo("req-no-such-model");
                })
                .verify();
    }

    @Test
    void resultIsAttributedAndLeaseReleased() {
        register("alpha", answer("hello"));

        StepVerifier.create(dispatcher.dispatch(request(Definitions.MODEL)))
                .assertNext(result -> {
                    assertThat(result.getContent()).isEqualTo("hello");
                    assertThat(result.getProviderSlug()).isEqualTo("alpha");
                    assertThat(result.getModel()).isEqualTo(Definitions.MODEL);
                    assertThat(result.getNativeModel()).isEqualTo("native-alpha");
                })
                .verifyComplete();

        assertThat(registry.leaseCount("alpha")).isZero();
        assertThat(healthMonitor.getStatus("alpha").getState()).isEqualTo(HealthState.HEALTHY);
        assertThat(meterRegistry.get("gateway.requests").tag("status", "success").counter().count()).isEqualTo(1.0);
    }

    @Test
    void unhealthyProviderIsNeverChosen() {
        ProviderAdapter alpha = register("alpha", answer("from alpha"));
        ProviderAdapter beta = register("beta", answer("from beta"));
        markUnhealthy("beta");

        for (int i = 0; i < 100; i++) {
            NormalizedResult result = dispatcher.dispatch(request(Definitions.MODEL)).block(Duration.ofSeconds(5));
            assertThat(result.getProviderSlug()).isEqualTo("alpha");
        }

        verify(alpha, times(100)).invoke(any());
        verify(beta, never()).invoke(any());
    }

    @Test
    void allCandidatesUnhealthy() {
        ProviderAdapter alpha = register("alpha", answer("a"));
        markUnhealthy("alpha");

        StepVerifier.create(dispatcher.dispatch(request(Definitions.MODEL)))
                .expectErrorSatisfies(error ->
                        assertThat(((GatewayException) error).getKind()).isEqualTo(ErrorKind.ALL_PROVIDERS_UNHEALTHY))
                .verify();
        verify(alpha, never()).invoke(any());
    }

    @Test
    void excludedProviderIsSkipped() {
        register("alpha", answer("a"));
        register("beta", answer("b"));

        NormalizedResult result = dispatcher.dispatch(request(Definitions.MODEL).excluding("beta"))
                .block(Duration.ofSeconds(5));

        assertThat(result.getProviderSlug()).isEqualTo("alpha");
    }

    @Test
    void conflictGoesToMostRecentlyEnabled() {
        register("alpha", answer("a"));
        register("beta", answer("b"));

        assertThat(dispatcher.dispatch(request(Definitions.MODEL)).block().getProviderSlug()).isEqualTo("beta");

        registry.setEnabled("alpha", false);
        registry.setEnabled("alpha", true);

        assertThat(dispatcher.dispatch(request(Definitions.MODEL)).block().getProviderSlug()).isEqualTo("alpha");
    }

    @Test
    void conflictIsRejectedWhenConfigured() {
        settings.setConflictPolicy(GatewayProperties.ConflictPolicy.REJECT);
        register("alpha", answer("a"));
        register("beta", answer("b"));

        StepVerifier.create(dispatcher.dispatch(request(Definitions.MODEL)))
                .expectErrorSatisfies(error -> {
                    GatewayException failure = (GatewayException) error;
                    assertThat(failure.getKind()).isEqualTo(ErrorKind.CONFIGURATION_INVALID);
                    assertThat(failure.getMessage()).contains("alpha", "beta");
                    assertThat(failure.getPublicMessage())
                            .isEqualTo(ErrorKind.CONFIGURATION_INVALID.getPublicMessage())
                            .doesNotContain("alpha")
                            .doesNotContain("beta");
                })
                .verify();
    }

    @Test
    void expiredBudgetFailsWithoutCallingProvider() {
        ProviderAdapter alpha = register("alpha", answer("a"));
        DispatchRequest late = request(Definitions.MODEL).toBuilder()
                .timeoutSeconds(5)
                .receivedAt(Instant.now().minusSeconds(10))
                .build();

        StepVerifier.create(dispatcher.dispatch(late))
                .expectErrorSatisfies(error -> assertThat(((GatewayException) error).getKind()).isEqualTo(ErrorKind.TIMEOUT))
                .verify();
        verify(alpha, never()).invoke(any());
    }

    @Test
    void deadlineIsTighterOfBudgetAndProviderTimeoutMinusMargin() {
        register("alpha", answer("a"));
        Provider alpha = registry.getProvider("alpha").orElseThrow();
        Instant received = Instant.parse("2024-05-01T10:00:00Z");

        Instant deadline = dispatcher.deadline(request(Definitions.MODEL).toBuilder()
                .timeoutSeconds(120)
                .receivedAt(received)
                .build(), alpha);

        assertThat(deadline).isEqualTo(received.plusSeconds(30).minusMillis(settings.getSafetyMarginMillis()));
    }

    @Test
    void providerFailuresFeedHealthButOverloadDoesNot() {
        register("alpha", Mono.error(AdapterException.upstream("HTTP 500")));
        register("busy", Mono.error(new AdapterException(ErrorKind.OVERLOADED, "bulkhead full")));
        registry.setEnabled("busy", false);

        for (int i = 0; i < 3; i++) {
            StepVerifier.create(dispatcher.dispatch(request(Definitions.MODEL)))
                    .expectErrorSatisfies(error -> {
                        GatewayException failure = (GatewayException) error;
                        assertThat(failure.getKind()).isEqualTo(ErrorKind.UPSTREAM_ERROR);
                        assertThat(failure.getProviderId()).isEqualTo("alpha");
                    })
                    .verify();
        }
        assertThat(healthMonitor.getStatus("alpha").getState()).isEqualTo(HealthState.UNHEALTHY);

        registry.setEnabled("busy", true);
        for (int i = 0; i < 5; i++) {
            StepVerifier.create(dispatcher.dispatch(request(Definitions.MODEL)))
                    .expectErrorSatisfies(error ->
                            assertThat(((GatewayException) error).getKind()).isEqualTo(ErrorKind.OVERLOADED))
                    .verify();
        }
        assertThat(healthMonitor.isRoutable("busy")).isTrue();
        assertThat(registry.leaseCount("busy")).isZero();
    }

    @Test
    void slowProviderDoesNotDelayAnotherModel() {
        ProviderAdapter slow = mock(ProviderAdapter.class);
        when(slow.invoke(any())).thenReturn(Mono.delay(Duration.ofSeconds(10)).then(answer("late")));
        adapters.put("slow", slow);
        registry.register(Definitions.withModel(Definitions.local("slow", "http://localhost:8000"), "slow-model", "s"));
        register("fast", answer("quick"));

        DispatchRequest slowRequest = request("slow-model");
        Disposable inFlight = dispatcher.dispatch(slowRequest).subscribe();
        try {
            long started = System.nanoTime();
            NormalizedResult fast = dispatcher.dispatch(request(Definitions.MODEL).excluding("slow"))
                    .block(Duration.ofSeconds(2));

            assertThat(fast.getContent()).isEqualTo("quick");
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(1));
            assertThat(registry.leaseCount("slow")).isEqualTo(1);
        } finally {
            inFlight.dispose();
        }
        assertThat(registry.leaseCount("slow")).isZero();
    }

    @Test
    void streamingRoutingErrorsSurfaceBeforeStreaming() {
        register("alpha", answer("a"));

        StepVerifier.create(dispatcher.dispatchStreaming(request("unknown")))
                .expectErrorSatisfies(error -> assertThat(((GatewayException) error).getKind()).isEqualTo(ErrorKind.NOT_FOUND))
                .verify();
    }

    @Test
    void streamingErrorChunkCountsAgainstProvider() {
        ProviderAdapter alpha = register("alpha", answer("a"));
        when(alpha.invokeStreaming(any())).thenReturn(Flux.just(
                StreamChunk.delta("par"),
                StreamChunk.error(ErrorKind.MALFORMED_UPSTREAM_RESPONSE, "garbage")));

        Flux<StreamChunk> chunks = dispatcher.dispatchStreaming(request(Definitions.MODEL)).block();

        StepVerifier.create(chunks)
                .expectNextMatches(chunk -> "par".equals(chunk.getContent()))
                .expectNextMatches(StreamChunk::isError)
                .verifyComplete();
        assertThat(healthMonitor.getStatus("alpha").getConsecutiveFailures()).isEqualTo(1);
        assertThat(registry.leaseCount("alpha")).isZero();
    }

    @Test
    void unreachableProviderBecomesUnhealthyAndIsNotDispatched() {
        GatewayProperties properties = new GatewayProperties();
        ObjectMapper objectMapper = new ObjectMapper();
        AdapterFactory realFactory = new AdapterFactory(WebClient.builder(),
                provider -> new ProviderCredentials(Map.of(ProviderCredentials.API_KEY, "sk-test")),
                new ResponseNormalizer(objectMapper), objectMapper, meterRegistry, BulkheadRegistry.ofDefaults(),
                new DirectProcessLauncher(properties.getSandbox(), Duration.ofMillis(200)),
                new DockerProcessLauncher(properties.getSandbox(), Duration.ofMillis(200)));
        wire(realFactory);
        registry.register(Definitions.httpSdk("remote", "http://127.0.0.1:1"));

        for (int i = 0; i < 3; i++) {
            assertThat(healthMonitor.probe("remote", ProbeTrigger.MANUAL).block(Duration.ofSeconds(10)).isSuccess())
                    .isFalse();
        }

        assertThat(healthMonitor.getStatus("remote").getState()).isEqualTo(HealthState.UNHEALTHY);
        StepVerifier.create(dispatcher.dispatch(request(Definitions.MODEL)))
                .expectErrorSatisfies(error ->
                        assertThat(((GatewayException) error).getKind()).isEqualTo(ErrorKind.ALL_PROVIDERS_UNHEALTHY))
                .verify(Duration.ofSeconds(5));
    }
}
