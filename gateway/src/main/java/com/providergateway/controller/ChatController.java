package com.providergateway.controller;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.providergateway.model.ChatModels;
import com.providergateway.model.GenerationParameters;
import com.providergateway.service.ChatCompletionService;
import com.providergateway.service.DispatchRequest;
import com.providergateway.service.RateLimitService;
import com.providergateway.service.StreamingPipeline;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class ChatController {

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final TypeReference<Map<String, Object>> RAW_BODY = new TypeReference<>() {
    };

    private final ChatCompletionService chatCompletionService;
    private final StreamingPipeline streamingPipeline;
    private final RateLimitService rateLimitService;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    /**
     * Chat completion endpoint (OpenAI-compatible). {@code stream: true}
     * switches the response to server-sent events.
     */
    @PostMapping("/chat/completions")
    public Mono<ResponseEntity<?>> chatCompletion(@Valid @RequestBody ChatModels.ChatRequest request,
                                                  ServerHttpRequest httpRequest) {
        HttpHeaders inbound = httpRequest.getHeaders();
        String identifier = extractIdentifier(inbound.getFirst(HttpHeaders.AUTHORIZATION), inbound.getFirst("X-Api-Key"));
        String requestId = requestId(inbound);
        boolean stream = Boolean.TRUE.equals(request.getStream());
        Timer.Sample sample = Timer.start(meterRegistry);

        log.info("Chat request received: model={}, messages={}, stream={}, requestId={}",
                request.getModel(), request.getMessages().size(), stream, requestId);

        if (!rateLimitService.tryConsume(identifier)) {
            return Mono.just(rateLimited(identifier, requestId));
        }

        DispatchRequest dispatchRequest = toDispatchRequest(request, requestId, inbound);
        HttpHeaders outbound = rateLimitHeaders(identifier, requestId);

        if (stream) {
            StreamingPipeline.StreamContext context = new StreamingPipeline.StreamContext(requestId,
                    "chatcmpl-" + requestId, request.getModel(), Instant.now().getEpochSecond());
            return chatCompletionService.stream(dispatchRequest)
                    .<ResponseEntity<?>>map(chunks -> ResponseEntity.ok()
                            .headers(outbound)
                            .contentType(MediaType.TEXT_EVENT_STREAM)
                            .body(streamingPipeline.toServerSentEvents(chunks, context)))
                    .doOnSuccess(response -> sample.stop(meterRegistry.timer("gateway.request.latency", "operation", "stream")));
        }

        return chatCompletionService.complete(request, dispatchRequest)
                .<ResponseEntity<?>>map(response -> ResponseEntity.ok()
                        .headers(outbound)
                        .body(response))
                .doOnSuccess(response -> sample.stop(meterRegistry.timer("gateway.request.latency", "operation", "chat")));
    }

    DispatchRequest toDispatchRequest(ChatModels.ChatRequest request, String requestId, HttpHeaders inbound) {
        Map<String, String> forwarded = new LinkedHashMap<>();
        inbound.forEach((name, values) -> {
            if (!values.isEmpty()) {
                forwarded.put(name.toLowerCase(Locale.ROOT), values.get(0));
            }
        });
        Map<String, Object> rawBody = objectMapper.convertValue(request, RAW_BODY);
        rawBody.remove("timeout_seconds");

        return DispatchRequest.builder()
                .requestId(requestId)
                .model(request.getModel())
                .messages(request.getMessages())
                .parameters(GenerationParameters.from(request))
                .timeoutSeconds(request.getTimeoutSeconds())
                .receivedAt(Instant.now())
                .forwardedHeaders(forwarded)
                .rawBody(rawBody)
                .build();
    }

    private HttpHeaders rateLimitHeaders(String identifier, String requestId) {
        RateLimitService.RateLimitInfo info = rateLimitService.getRateLimitInfo(identifier);
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-RateLimit-Limit", String.valueOf(info.limit()));
        headers.set("X-RateLimit-Remaining", String.valueOf(info.remaining()));
        headers.set("X-RateLimit-Reset", String.valueOf(info.resetSeconds()));
        headers.set(REQUEST_ID_HEADER, requestId);
        return headers;
    }

    private ResponseEntity<?> rateLimited(String identifier, String requestId) {
        RateLimitService.RateLimitInfo info = rateLimitService.getRateLimitInfo(identifier);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .headers(rateLimitHeaders(identifier, requestId))
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, info.resetSeconds())))
                .body(ChatModels.ErrorResponse.builder()
                        .error(ChatModels.ErrorResponse.Error.builder()
                                .type("rate_limit_error")
                                .code("rate_limit_exceeded")
                                .message("Rate limit exceeded. Please try again later.")
                                .correlationId(requestId)
                                .build())
                        .build());
    }

    private static String requestId(HttpHeaders inbound) {
        String supplied = inbound.getFirst(REQUEST_ID_HEADER);
        if (supplied != null && !supplied.isBlank() && supplied.length() <= 128) {
            return supplied;
        }
        return "req-" + UUID.randomUUID();
    }

    private static String extractIdentifier(String authorization, String apiKey) {
        if (apiKey != null && !apiKey.isEmpty()) {
            return apiKey;
        }
        if (authorization != null && authorization.startsWith("Bearer ")) {
            return authorization.substring(7);
        }
        return "anonymous";
    }
}
