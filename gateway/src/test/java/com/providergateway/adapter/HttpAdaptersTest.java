package com.providergateway.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.providergateway.adapter.auth.ProviderCredentials;
import com.providergateway.error.ErrorKind;
import com.providergateway.error.GatewayException;
import com.providergateway.model.ChatModels;
import com.providergateway.model.GenerationParameters;
import com.providergateway.model.HealthProbeResult;
import com.providergateway.model.Provider;
import com.providergateway.model.ProviderDefinition;
import com.providergateway.service.ProviderConfigValidator;
import com.providergateway.service.ResponseNormalizer;
import com.providergateway.support.Definitions;
import com.providergateway.support.StubExchange;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HttpAdaptersTest {

    private static final String COMPLETION = "{\"id\":\"cmpl-1\",\"choices\":[{\"index\":0,"
            + "\"message\":{\"role\":\"assistant\",\"content\":\"hello\"},\"finish_reason\":\"stop\"}],"
            + "\"usage\":{\"prompt_tokens\":3,\"completion_tokens\":1,\"total_tokens\":4}}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResponseNormalizer normalizer = new ResponseNormalizer(objectMapper);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final ProviderConfigValidator validator = new ProviderConfigValidator();
    private final ProviderCredentials credentials = new ProviderCredentials(Map.of(ProviderCredentials.API_KEY, "sk-upstream"));

    private AdapterRequest request(Provider provider) {
        return AdapterRequest.builder()
                .requestId("req-1")
                .externalModelId(Definitions.MODEL)
                .nativeModelId(provider.getModels().get(0).getNativeId())
                .message(ChatModels.Message.builder().role("user").content("hi").build())
                .parameters(GenerationParameters.builder().temperature(0.2).maxTokens(16).build())
                .deadline(Instant.now().plusSeconds(5))
                .build();
    }

    private JsonNode body(ClientRequest request) throws Exception {
        return objectMapper.readTree(StubExchange.bodyOf(request));
    }

    @Test
    void httpSdkSendsBearerKeyAndNormalizesResponse() throws Exception {
        Provider provider = validator.validate(Definitions.httpSdk("openai", "https://api.example.com/v1"));
        StubExchange upstream = StubExchange.json(HttpStatus.OK, COMPLETION);
        HttpSdkAdapter adapter = new HttpSdkAdapter(provider, upstream.client("https://api.example.com/v1"),
                credentials, normalizer, meterRegistry);

        StepVerifier.create(adapter.invoke(request(provider)))
                .assertNext(result -> {
                    assertThat(result.getContent()).isEqualTo("hello");
                    assertThat(result.getFinishReason()).isEqualTo("stop");
                    assertThat(result.getUsage().getTotalTokens()).isEqualTo(4);
                })
                .verifyComplete();

        ClientRequest sent = upstream.lastRequest();
        assertThat(sent.method()).isEqualTo(HttpMethod.POST);
        assertThat(sent.url().toString()).isEqualTo("https://api.example.com/v1/chat/completions");
        assertThat(sent.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-upstream");
        JsonNode json = body(sent);
        assertThat(json.get("model").asText()).isEqualTo("native-openai");
        assertThat(json.get("temperature").asDouble()).isEqualTo(0.2);
        assertThat(json.has("stream")).isFalse();
    }

    @Test
    void httpSdkMapsServerErrorToUpstreamError() {
        Provider provider = validator.validate(Definitions.httpSdk("openai", "https://api.example.com/v1"));
        StubExchange upstream = StubExchange.json(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":{\"message\":\"down\"}}");
        HttpSdkAdapter adapter = new HttpSdkAdapter(provider, upstream.client("https://api.example.com/v1"),
                credentials, normalizer, meterRegistry);

        StepVerifier.create(adapter.invoke(request(provider)))
                .expectErrorSatisfies(error -> assertThat(((GatewayException) error).getKind())
                        .isEqualTo(ErrorKind.UPSTREAM_ERROR))
                .verify();
    }

    @Test
    void httpSdkWithoutKeyIsAConfigurationError() {
        Provider provider = validator.validate(Definitions.httpSdk("openai", "https://api.example.com/v1"));
        StubExchange upstream = StubExchange.json(HttpStatus.OK, COMPLETION);
        HttpSdkAdapter adapter = new HttpSdkAdapter(provider, upstream.client("https://api.example.com/v1"),
                ProviderCredentials.EMPTY, normalizer, meterRegistry);

        StepVerifier.create(adapter.invoke(request(provider)))
                .expectErrorSatisfies(error -> assertThat(((GatewayException) error).getKind())
                        .isEqualTo(ErrorKind.CONFIGURATION_INVALID))
                .verify();
        assertThat(upstream.getRequests()).isEmpty();
    }

    @Test
    void httpSdkParsesServerSentEvents() {
        Provider provider = validator.validate(Definitions.httpSdk("openai", "https://api.example.com/v1"));
        StubExchange upstream = StubExchange.eventStream(
                "data: {\"choices\":[{\"delta\":{\"role\":\"assistant\",\"content\":\"Hel\"}}]}\n\n"
                        + "data: {\"choices\":[{\"delta\":{\"content\":\"lo\"},\"finish_reason\":\"stop\"}]}\n\n"
                        + "data: [DONE]\n\n");
        HttpSdkAdapter adapter = new HttpSdkAdapter(provider, upstream.client("https://api.example.com/v1"),
                credentials, normalizer, meterRegistry);

        StepVerifier.create(adapter.invokeStreaming(request(provider)).take(2))
                .assertNext(chunk -> {
                    assertThat(chunk.getContent()).isEqualTo("Hel");
                    assertThat(chunk.isTerminal()).isFalse();
                })
                .assertNext(chunk -> {
                    assertThat(chunk.getContent()).isEqualTo("lo");
                    assertThat(chunk.getFinishReason()).isEqualTo("stop");
                    assertThat(chunk.isTerminal()).isTrue();
                })
                .verifyComplete();
    }

    @Test
    void httpSdkProbeUsesHealthPath() {
        Provider provider = validator.validate(Definitions.httpSdk("openai", "https://api.example.com/v1"));
        StubExchange upstream = StubExchange.json(HttpStatus.OK, "{\"data\":[]}");
        HttpSdkAdapter adapter = new HttpSdkAdapter(provider, upstream.client("https://api.example.com/v1"),
                credentials, normalizer, meterRegistry);

        HealthProbeResult result = adapter.healthCheck(Instant.now().plusSeconds(5)).block();

        assertThat(result.isSuccess()).isTrue();
        assertThat(upstream.lastRequest().method()).isEqualTo(HttpMethod.GET);
        assertThat(upstream.lastRequest().url().getPath()).isEqualTo("/v1/models");
        assertThat(upstream.lastRequest().headers().getFirst(AbstractHttpAdapter.PROBE_HEADER)).isEqualTo("true");
    }

    @Test
    void failedProbeIsReportedNotThrown() {
        Provider provider = validator.validate(Definitions.httpSdk("openai", "https://api.example.com/v1"));
        StubExchange upstream = StubExchange.json(HttpStatus.INTERNAL_SERVER_ERROR, "boom");
        HttpSdkAdapter adapter = new HttpSdkAdapter(provider, upstream.client("https://api.example.com/v1"),
                credentials, normalizer, meterRegistry);

        HealthProbeResult result = adapter.healthCheck(Instant.now().plusSeconds(5)).block();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.UPSTREAM_ERROR);
    }

    private Provider proxyProvider() {
        ProviderDefinition definition = new ProviderDefinition();
        definition.setName("Upstream proxy");
        definition.setSlug("relay");
        definition.setType("proxy");
        ProviderDefinition.ProxySettings settings = new ProviderDefinition.ProxySettings();
        settings.setProxyBaseUrl("https://relay.example.com");
        settings.setForwardHeaders(List.of("X-Trace-Id", "Authorization"));
        settings.setTransformsEnabled(true);
        settings.setRequestOverrides(Map.of("temperature", 0.1));
        definition.setProxy(settings);
        return validator.validate(Definitions.withModel(definition, Definitions.MODEL, "gpt-relay"));
    }

    @Test
    void proxyForwardsBodyWithGatewayKeyOnly() throws Exception {
        Provider provider = proxyProvider();
        StubExchange upstream = StubExchange.json(HttpStatus.OK, COMPLETION);
        ProxyAdapter adapter = new ProxyAdapter(provider, upstream.client("https://relay.example.com"),
                credentials, normalizer, meterRegistry);
        AdapterRequest request = request(provider).toBuilder()
                .forwardedHeader("authorization", "Bearer client-key")
                .forwardedHeader("x-trace-id", "trace-42")
                .forwardedHeader("x-other", "dropped")
                .rawBody(Map.of("model", Definitions.MODEL, "messages", List.of(Map.of("role", "user", "content", "hi")),
                        "temperature", 0.9, "logit_bias", Map.of("50256", -100)))
                .build();

        StepVerifier.create(adapter.invoke(request))
                .assertNext(result -> assertThat(result.getContent()).isEqualTo("hello"))
                .verifyComplete();

        ClientRequest sent = upstream.lastRequest();
        assertThat(sent.url().toString()).isEqualTo("https://relay.example.com/v1/chat/completions");
        assertThat(sent.headers().get(HttpHeaders.AUTHORIZATION)).containsExactly("Bearer sk-upstream");
        assertThat(sent.headers().getFirst("x-trace-id")).isEqualTo("trace-42");
        assertThat(sent.headers().containsKey("x-other")).isFalse();
        JsonNode json = body(sent);
        assertThat(json.get("model").asText()).isEqualTo("gpt-relay");
        assertThat(json.get("stream").asBoolean()).isFalse();
        assertThat(json.get("temperature").asDouble()).isEqualTo(0.1);
        assertThat(json.at("/logit_bias/50256").asInt()).isEqualTo(-100);
    }

    @Test
    void proxyPassesPlainTextThrough() {
        Provider provider = proxyProvider();
        StubExchange upstream = StubExchange.json(HttpStatus.OK, "just text\n");
        ProxyAdapter adapter = new ProxyAdapter(provider, upstream.client("https://relay.example.com"),
                credentials, normalizer, meterRegistry);

        StepVerifier.create(adapter.invoke(request(provider)))
                .assertNext(result -> assertThat(result.getContent()).isEqualTo("just text"))
                .verifyComplete();
    }

    @Test
    void ollamaBodyCarriesOptionsAndTaggedModel() {
        ProviderDefinition definition = Definitions.local("ollama", "http://localhost:11434");
        definition.getLocal().setProtocol("ollama");
        Provider provider = validator.validate(definition);
        LocalAdapter adapter = new LocalAdapter(provider, StubExchange.json(HttpStatus.OK, "{}").client("http://localhost:11434"),
                BulkheadRegistry.ofDefaults(), normalizer, meterRegistry);

        Map<String, Object> body = adapter.buildBody(request(provider), false);

        assertThat(body.get("model")).isEqualTo("native-ollama:latest");
        assertThat(body.get("stream")).isEqualTo(false);
        assertThat(body.get("options")).isEqualTo(Map.of("temperature", 0.2, "num_predict", 16));
        assertThat(LocalAdapter.ollamaModel("llama3:8b")).isEqualTo("llama3:8b");
    }

    @Test
    void ollamaNativeResponseIsNormalized() {
        ProviderDefinition definition = Definitions.local("ollama", "http://localhost:11434");
        definition.getLocal().setProtocol("ollama");
        Provider provider = validator.validate(definition);
        StubExchange upstream = StubExchange.json(HttpStatus.OK,
                "{\"model\":\"native-ollama:latest\",\"message\":{\"role\":\"assistant\",\"content\":\"hi there\"},"
                        + "\"done\":true,\"done_reason\":\"stop\",\"prompt_eval_count\":5,\"eval_count\":2}");
        LocalAdapter adapter = new LocalAdapter(provider, upstream.client("http://localhost:11434"),
                BulkheadRegistry.ofDefaults(), normalizer, meterRegistry);

        StepVerifier.create(adapter.invoke(request(provider)))
                .assertNext(result -> {
                    assertThat(result.getContent()).isEqualTo("hi there");
                    assertThat(result.getFinishReason()).isEqualTo("stop");
                })
                .verifyComplete();
        assertThat(upstream.lastRequest().url().getPath()).isEqualTo("/api/chat");
    }

    @Test
    void localAdapterRejectsCallsBeyondItsConcurrencyCap() throws Exception {
        ProviderDefinition definition = Definitions.local("local", "http://localhost:8000");
        definition.getLocal().setMaxConcurrentRequests(1);
        definition.getLocal().setQueueTimeoutMillis(50L);
        Provider provider = validator.validate(definition);
        WebClient hanging = WebClient.builder().baseUrl("http://localhost:8000")
                .exchangeFunction(request -> Mono.never())
                .build();
        LocalAdapter adapter = new LocalAdapter(provider, hanging, BulkheadRegistry.ofDefaults(), normalizer, meterRegistry);

        Disposable first = adapter.invoke(request(provider)).subscribe(result -> { }, error -> { });
        try {
            long waitUntil = System.currentTimeMillis() + 2000;
            while (adapter.getBulkhead().getMetrics().getAvailableConcurrentCalls() > 0
                    && System.currentTimeMillis() < waitUntil) {
                Thread.sleep(10);
            }

            StepVerifier.create(adapter.invoke(request(provider)))
                    .expectErrorSatisfies(error -> assertThat(((GatewayException) error).getKind())
                            .isEqualTo(ErrorKind.OVERLOADED))
                    .verify();
        } finally {
            first.dispose();
        }

        long waitUntil = System.currentTimeMillis() + 2000;
        while (adapter.getBulkhead().getMetrics().getAvailableConcurrentCalls() < 1
                && System.currentTimeMillis() < waitUntil) {
            Thread.sleep(10);
        }
        assertThat(adapter.getBulkhead().getMetrics().getAvailableConcurrentCalls()).isEqualTo(1);
    }

    @Test
    void expiredDeadlineFailsWithTimeout() {
        Provider provider = validator.validate(Definitions.httpSdk("openai", "https://api.example.com/v1"));
        WebClient hanging = WebClient.builder().baseUrl("https://api.example.com/v1")
                .exchangeFunction(request -> Mono.never())
                .build();
        HttpSdkAdapter adapter = new HttpSdkAdapter(provider, hanging, credentials, normalizer, meterRegistry);
        AdapterRequest request = request(provider).toBuilder()
                .deadline(Instant.now().plusMillis(200))
                .build();

        StepVerifier.create(adapter.invoke(request))
                .expectErrorSatisfies(error -> assertThat(((GatewayException) error).getKind())
                        .isEqualTo(ErrorKind.TIMEOUT))
                .verify();
    }
}
