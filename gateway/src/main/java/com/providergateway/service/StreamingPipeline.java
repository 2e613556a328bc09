package com.providergateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.providergateway.adapter.ErrorClassifier;
import com.providergateway.error.ErrorKind;
import com.providergateway.error.GatewayException;
import com.providergateway.model.ChatModels;
import com.providergateway.model.StreamChunk;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns whatever an adapter streams into a well-formed chunk sequence and
 * renders it as OpenAI-compatible server-sent events.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StreamingPipeline {

    static final String DONE = "[DONE]";
    static final String CHUNK_OBJECT = "chat.completion.chunk";

    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final GatewayEventLogger events;

    /**
     * Guarantees a non-empty, ordered, indexed sequence that ends with exactly
     * one terminal chunk, whatever the source does.
     */
    public Flux<StreamChunk> guard(Flux<StreamChunk> source, String requestId) {
        return Flux.defer(() -> {
            AtomicBoolean terminated = new AtomicBoolean();
            AtomicLong index = new AtomicLong();

            return source
                    .takeUntil(StreamChunk::isTerminal)
                    .onErrorResume(error -> {
                        GatewayException failure = ErrorClassifier.classify(error, "stream");
                        events.warn("stream_failed", failure.getProviderId(), requestId, Map.of(
                                "kind", failure.getKind().getCode(),
                                "detail", String.valueOf(failure.getMessage())));
                        return Mono.just(StreamChunk.error(failure.getKind(), failure.getMessage()));
                    })
                    .doOnNext(chunk -> {
                        if (chunk.isTerminal()) {
                            terminated.set(true);
                        }
                    })
                    .concatWith(Mono.fromSupplier(() -> StreamChunk.error(ErrorKind.MALFORMED_UPSTREAM_RESPONSE,
                                    "Stream ended without a finish chunk"))
                            .filter(chunk -> !terminated.get())
                            .doOnNext(chunk -> log.warn("Stream {} ended without a terminal chunk", requestId)))
                    .map(chunk -> chunk.withIndex(index.getAndIncrement()))
                    .doOnCancel(() -> {
                        meterRegistry.counter("gateway.stream.cancelled").increment();
                        events.info("stream_cancelled", null, requestId, Map.of("chunksDelivered", index.get()));
                    });
        });
    }

    public Flux<ServerSentEvent<String>> toServerSentEvents(Flux<StreamChunk> chunks, StreamContext context) {
        return chunks
                .map(chunk -> ServerSentEvent.builder(render(chunk, context)).build())
                .concatWith(Mono.just(ServerSentEvent.builder(DONE).build()));
    }

    String render(StreamChunk chunk, StreamContext context) {
        if (chunk.isError()) {
            return json(ChatModels.ErrorResponse.builder()
                    .error(ChatModels.ErrorResponse.Error.builder()
                            .message(chunk.getErrorKind().getPublicMessage())
                            .type(chunk.getErrorKind().getType())
                            .code(chunk.getErrorKind().getCode())
                            .correlationId(context.requestId())
                            .build())
                    .build());
        }
        String role = chunk.getRole() != null ? chunk.getRole() : (chunk.getIndex() == 0 ? "assistant" : null);
        ChatModels.Delta delta = ChatModels.Delta.builder()
                .role(role)
                .content(chunk.getContent())
                .build();
        return json(ChatModels.ChatResponse.builder()
                .id(context.completionId())
                .object(CHUNK_OBJECT)
                .created(context.created())
                .model(context.model())
                .choices(List.of(ChatModels.Choice.builder()
                        .index(0)
                        .delta(delta)
                        .finishReason(chunk.getFinishReason())
                        .build()))
                .usage(chunk.getUsage())
                .build());
    }

    private String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render stream event", e);
        }
    }

    /**
     * Identity shared by every event of one streamed completion.
     */
    public record StreamContext(String requestId, String completionId, String model, long created) {
    }
}
