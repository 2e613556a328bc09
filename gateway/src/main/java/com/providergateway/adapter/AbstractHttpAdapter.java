package com.providergateway.adapter;

import com.providergateway.error.GatewayException;
import com.providergateway.error.Sanitizer;
import com.providergateway.model.ChatModels;
import com.providergateway.model.GenerationParameters;
import com.providergateway.model.HealthProbeResult;
import com.providergateway.model.NormalizedResult;
import com.providergateway.model.Provider;
import com.providergateway.model.StreamChunk;
import com.providergateway.service.ResponseNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared request/response plumbing for the adapters that talk HTTP. Subclasses
 * decide paths, body shape, auth headers and how a stream is framed.
 */
@Slf4j
public abstract class AbstractHttpAdapter implements ProviderAdapter {

    public static final String PROBE_HEADER = "X-Gateway-Probe";

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    protected final Provider provider;
    protected final WebClient webClient;
    protected final ResponseNormalizer normalizer;
    protected final MeterRegistry meterRegistry;

    protected AbstractHttpAdapter(Provider provider, WebClient webClient,
                                  ResponseNormalizer normalizer, MeterRegistry meterRegistry) {
        this.provider = provider;
        this.webClient = webClient;
        this.normalizer = normalizer;
        this.meterRegistry = meterRegistry;
    }

    protected abstract String chatPath();

    /**
     * GET target for probes. Blank means the probe is a one-token completion.
     */
    protected abstract String healthPath();

    protected abstract Map<String, Object> buildBody(AdapterRequest request, boolean stream);

    /**
     * Auth and static headers for one call. May need a network round trip (oauth).
     */
    protected Mono<HttpHeaders> requestHeaders(AdapterRequest request) {
        return Mono.just(new HttpHeaders());
    }

    protected String contentPointer() {
        return null;
    }

    /**
     * Raw stream units from the response: SSE data payloads by default.
     */
    protected Flux<String> streamPayloads(WebClient.ResponseSpec response) {
        return response.bodyToFlux(SSE_TYPE)
                .filter(event -> event.data() != null)
                .map(ServerSentEvent::data);
    }

    /**
     * Admission control around a call; the local adapter caps concurrency here.
     */
    protected <T> Mono<T> admit(Mono<T> call) {
        return call;
    }

    protected <T> Flux<T> admit(Flux<T> call) {
        return call;
    }

    protected String describe() {
        return getType() + " provider " + provider.getSlug();
    }

    @Override
    public Mono<NormalizedResult> invoke(AdapterRequest request) {
        Mono<NormalizedResult> call = Mono.defer(() -> {
            long started = System.nanoTime();
            Timer.Sample sample = Timer.start(meterRegistry);
            Map<String, Object> body = buildBody(request, false);
            log.debug("{} chat request: model={}, requestId={}", describe(), request.getNativeModelId(), request.getRequestId());

            return Mono.defer(() -> requestHeaders(request))
                    .flatMap(headers -> webClient.post()
                            .uri(chatPath())
                            .headers(h -> h.addAll(headers))
                            .contentType(MediaType.APPLICATION_JSON)
                            .bodyValue(body)
                            .retrieve()
                            .bodyToMono(String.class)
                            .defaultIfEmpty(""))
                    .map(raw -> normalizer.normalize(getType(), raw, request, contentPointer()))
                    .map(result -> result.toBuilder()
                            .latencyMs(Duration.ofNanos(System.nanoTime() - started).toMillis())
                            .build())
                    .doOnSuccess(result -> sample.stop(latencyTimer("invoke")));
        });
        return Deadlines.bound(admit(call), request.getDeadline(), describe())
                .onErrorMap(error -> ErrorClassifier.classify(error, describe()));
    }

    @Override
    public Flux<StreamChunk> invokeStreaming(AdapterRequest request) {
        Flux<StreamChunk> call = Flux.defer(() -> {
            Map<String, Object> body = buildBody(request, true);
            log.debug("{} stream request: model={}, requestId={}", describe(), request.getNativeModelId(), request.getRequestId());

            return Mono.defer(() -> requestHeaders(request))
                    .flatMapMany(headers -> streamPayloads(webClient.post()
                            .uri(chatPath())
                            .headers(h -> {
                                h.addAll(headers);
                                h.setAccept(List.of(MediaType.TEXT_EVENT_STREAM, MediaType.APPLICATION_NDJSON));
                            })
                            .contentType(MediaType.APPLICATION_JSON)
                            .bodyValue(body)
                            .retrieve()))
                    .mapNotNull(payload -> normalizer.normalizeChunk(getType(), payload));
        });
        return Deadlines.bound(admit(call), request.getDeadline(), describe())
                .onErrorMap(error -> ErrorClassifier.classify(error, describe()));
    }

    @Override
    public Mono<HealthProbeResult> healthCheck(Instant deadline) {
        long started = System.nanoTime();
        String path = healthPath();
        boolean completionProbe = path == null || path.isBlank();
        AdapterRequest probe = probeRequest(deadline);
        String requestSnapshot = completionProbe
                ? "POST " + chatPath() + " " + Sanitizer.snapshot(String.valueOf(buildBody(probe, false)))
                : "GET " + path;

        Mono<String> call = Mono.defer(() -> requestHeaders(probe)).flatMap(headers -> {
            if (completionProbe) {
                return webClient.post()
                        .uri(chatPath())
                        .headers(h -> h.addAll(headers))
                        .header(PROBE_HEADER, "true")
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(buildBody(probe, false))
                        .retrieve()
                        .bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(raw -> normalizer.normalize(getType(), raw, probe, contentPointer()).getContent());
            }
            return webClient.get()
                    .uri(path)
                    .headers(h -> h.addAll(headers))
                    .header(PROBE_HEADER, "true")
                    .retrieve()
                    .bodyToMono(String.class)
                    .defaultIfEmpty("");
        });

        return Deadlines.bound(call, deadline, describe() + " probe")
                .map(response -> HealthProbeResult.builder()
                        .success(true)
                        .latencyMs(Duration.ofNanos(System.nanoTime() - started).toMillis())
                        .requestSnapshot(requestSnapshot)
                        .responseSnapshot(Sanitizer.snapshot(response))
                        .build())
                .onErrorResume(error -> {
                    GatewayException classified = ErrorClassifier.classify(error, describe());
                    log.atDebug()
                            .addKeyValue("probe", true)
                            .addKeyValue("providerId", provider.getId())
                            .log("Probe failed: {}", Sanitizer.redact(classified.getMessage()));
                    return Mono.just(HealthProbeResult.failure(classified.getKind(),
                            Sanitizer.snapshot(classified.getMessage()), requestSnapshot,
                            Duration.ofNanos(System.nanoTime() - started).toMillis()));
                });
    }

    protected AdapterRequest probeRequest(Instant deadline) {
        String nativeModel = provider.getModels().isEmpty() ? "" : provider.getModels().get(0).getNativeId();
        String externalModel = provider.getModels().isEmpty() ? "" : provider.getModels().get(0).getExternalId();
        Map<String, Object> rawBody = new LinkedHashMap<>();
        rawBody.put("model", externalModel);
        rawBody.put("messages", List.of(Map.of("role", "user", "content", "ping")));
        rawBody.put("max_tokens", 1);
        return AdapterRequest.builder()
                .requestId("probe-" + provider.getId())
                .externalModelId(externalModel)
                .nativeModelId(nativeModel)
                .message(ChatModels.Message.builder().role("user").content("ping").build())
                .parameters(GenerationParameters.builder().maxTokens(1).build())
                .rawBody(rawBody)
                .deadline(deadline)
                .probe(true)
                .build();
    }

    protected Timer latencyTimer(String operation) {
        return meterRegistry.timer("gateway.adapter.latency",
                "provider", provider.getSlug(), "type", getType().getWireName(), "operation", operation);
    }

    /**
     * OpenAI chat body: model, messages, the set generation parameters and the stream flag.
     */
    protected Map<String, Object> openAiBody(String model, AdapterRequest request, boolean stream) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", request.getMessages());
        body.putAll(request.getParameters().toOpenAiFields());
        if (stream) {
            body.put("stream", true);
        }
        return body;
    }
}
