package com.providergateway.service;

import com.providergateway.config.GatewayProperties;
import com.providergateway.error.ErrorKind;
import com.providergateway.error.GatewayException;
import com.providergateway.model.ChatModels;
import com.providergateway.model.NormalizedResult;
import com.providergateway.model.StreamChunk;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Endpoint-level orchestration of a completion: cache lookup, one dispatch,
 * and optional fallback to another provider on a retryable failure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatCompletionService {

    private final Dispatcher dispatcher;
    private final CacheService cacheService;
    private final StreamingPipeline streamingPipeline;
    private final GatewayProperties properties;
    private final MeterRegistry meterRegistry;

    public Mono<ChatModels.ChatResponse> complete(ChatModels.ChatRequest request, DispatchRequest dispatchRequest) {
        return cacheService.getCachedResponse(request)
                .map(cached -> {
                    cached.getGateway().setRequestId(dispatchRequest.getRequestId());
                    return cached;
                })
                .switchIfEmpty(Mono.defer(() -> dispatchWithFallback(dispatchRequest, 0)
                        .map(result -> toChatResponse(result, dispatchRequest.getRequestId()))
                        .flatMap(response -> cacheService.cacheResponse(request, response).thenReturn(response))));
    }

    /**
     * Streams are never re-dispatched: once routed, the chosen provider owns the stream.
     */
    public Mono<Flux<StreamChunk>> stream(DispatchRequest dispatchRequest) {
        return dispatcher.dispatchStreaming(dispatchRequest)
                .map(chunks -> streamingPipeline.guard(chunks, dispatchRequest.getRequestId()));
    }

    private Mono<NormalizedResult> dispatchWithFallback(DispatchRequest request, int attempt) {
        return dispatcher.dispatch(request)
                .map(result -> result.toBuilder().retryCount(attempt).build())
                .onErrorResume(GatewayException.class, error -> {
                    if (!canFallBack(error, attempt)) {
                        return Mono.error(error);
                    }
                    log.warn("Provider {} failed with {} for request {}, trying an alternate",
                            error.getProviderId(), error.getKind().getCode(), request.getRequestId());
                    meterRegistry.counter("gateway.fallbacks", "kind", error.getKind().getCode()).increment();
                    return dispatchWithFallback(request.excluding(error.getProviderId()), attempt + 1)
                            .onErrorResume(GatewayException.class, next -> Mono.error(
                                    next.getKind() == ErrorKind.ALL_PROVIDERS_UNHEALTHY ? error : next));
                });
    }

    private boolean canFallBack(GatewayException error, int attempt) {
        GatewayProperties.DispatchSettings settings = properties.getDispatch();
        return settings.isFallbackEnabled()
                && attempt < settings.getMaxFallbacks()
                && error.getKind().isRetryable()
                && error.getProviderId() != null;
    }

    ChatModels.ChatResponse toChatResponse(NormalizedResult result, String requestId) {
        return ChatModels.ChatResponse.builder()
                .id(result.getId() != null ? result.getId() : requestId)
                .object("chat.completion")
                .created(System.currentTimeMillis() / 1000)
                .model(result.getModel())
                .choices(List.of(ChatModels.Choice.builder()
                        .index(0)
                        .message(ChatModels.Message.builder()
                                .role(result.getRole())
                                .content(result.getContent())
                                .build())
                        .finishReason(result.getFinishReason() != null ? result.getFinishReason() : "stop")
                        .build()))
                .usage(result.getUsage())
                .gateway(ChatModels.GatewayMetadata.builder()
                        .provider(result.getProviderSlug())
                        .nativeModel(result.getNativeModel())
                        .latencyMs(result.getLatencyMs())
                        .cached(false)
                        .retryCount(result.getRetryCount())
                        .requestId(requestId)
                        .build())
                .build();
    }
}
