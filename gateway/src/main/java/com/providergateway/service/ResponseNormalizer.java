package com.providergateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.providergateway.adapter.AdapterRequest;
import com.providergateway.error.AdapterException;
import com.providergateway.error.ErrorKind;
import com.providergateway.error.Sanitizer;
import com.providergateway.model.AdapterType;
import com.providergateway.model.ChatModels;
import com.providergateway.model.NormalizedResult;
import com.providergateway.model.StreamChunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps raw adapter output onto {@link NormalizedResult} and {@link StreamChunk}.
 * <p>
 * Recognized shapes, tried in order: {@code {"error": ...}}, OpenAI chat completion
 * or chunk, Ollama {@code message}/{@code done}, and flat objects carrying one of
 * {@code content}, {@code text}, {@code output} or {@code response}. Spawn-cli output
 * that is not JSON is plain text. Proxy output that matches nothing passes through
 * raw. Anything else is malformed and reported, never dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResponseNormalizer {

    private static final String DONE_MARKER = "[DONE]";
    private static final List<String> SIMPLE_CONTENT_FIELDS = List.of("content", "text", "output", "response");

    private final ObjectMapper objectMapper;

    public NormalizedResult normalize(AdapterType type, String raw, AdapterRequest request) {
        return normalize(type, raw, request, null);
    }

    /**
     * @param contentPointer JSON pointer tried before the known shapes; proxy transforms only
     */
    public NormalizedResult normalize(AdapterType type, String raw, AdapterRequest request, String contentPointer) {
        String body = raw == null ? "" : raw;
        JsonNode node = parse(body);

        if (node == null || !node.isObject()) {
            if (type == AdapterType.SPAWN_CLI || type == AdapterType.PROXY) {
                return text(stripTrailingNewline(body), request);
            }
            throw AdapterException.malformed(type + " response is not a JSON object: " + Sanitizer.snapshot(body), null);
        }

        if (node.has("error") && !node.get("error").isNull()) {
            throw AdapterException.upstream(type + " reported an error: " + errorMessage(node.get("error")));
        }

        if (contentPointer != null && !contentPointer.isBlank()) {
            JsonNode pointed = node.at(contentPointer);
            if (pointed.isValueNode()) {
                return result(request, node, pointed.asText(), textOrNull(node, "finish_reason"), usage(node));
            }
            log.debug("Content pointer {} matched nothing in {} response", contentPointer, type);
        }

        JsonNode choices = node.get("choices");
        if (choices != null && choices.isArray() && choices.size() > 0) {
            JsonNode choice = choices.get(0);
            JsonNode message = choice.get("message");
            String content = message != null && message.hasNonNull("content")
                    ? message.get("content").asText()
                    : textOrNull(choice, "text");
            String role = message != null ? textOrNull(message, "role") : null;
            NormalizedResult result = result(request, node, content, textOrNull(choice, "finish_reason"), usage(node));
            return role != null ? result.toBuilder().role(role).build() : result;
        }

        JsonNode message = node.get("message");
        if (message != null && message.isObject() && message.has("content")) {
            String finish = textOrNull(node, "done_reason");
            if (finish == null && node.path("done").asBoolean(false)) {
                finish = "stop";
            }
            return result(request, node, message.get("content").asText(), finish, ollamaUsage(node));
        }

        for (String field : SIMPLE_CONTENT_FIELDS) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode()) {
                return result(request, node, value.asText(), textOrNull(node, "finish_reason"), usage(node));
            }
        }

        if (type == AdapterType.PROXY || type == AdapterType.SPAWN_CLI) {
            return text(body, request);
        }
        throw AdapterException.malformed(type + " response has no recognizable content: " + Sanitizer.snapshot(body), null);
    }

    /**
     * One raw streamed unit: an SSE data payload, an NDJSON line or a CLI output line.
     *
     * @return the chunk, or {@code null} for keep-alive blanks
     */
    public StreamChunk normalizeChunk(AdapterType type, String rawChunk) {
        if (rawChunk == null || rawChunk.isBlank()) {
            return null;
        }
        String data = rawChunk.trim();
        if (DONE_MARKER.equals(data)) {
            return StreamChunk.finish("stop", null);
        }

        JsonNode node = parse(data);
        if (node == null || !node.isObject()) {
            if (type == AdapterType.PROXY) {
                return StreamChunk.delta(rawChunk);
            }
            return StreamChunk.error(ErrorKind.MALFORMED_UPSTREAM_RESPONSE,
                    type + " sent an unparsable chunk: " + Sanitizer.snapshot(data));
        }

        if (node.has("error") && !node.get("error").isNull()) {
            return StreamChunk.error(ErrorKind.UPSTREAM_ERROR, type + " reported an error: " + errorMessage(node.get("error")));
        }

        JsonNode choices = node.get("choices");
        if (choices != null && choices.isArray()) {
            if (choices.size() == 0) {
                // Trailing usage-only chunk.
                ChatModels.Usage usage = usage(node);
                return usage != null ? StreamChunk.builder().usage(usage).build() : null;
            }
            JsonNode choice = choices.get(0);
            JsonNode delta = choice.path("delta");
            String content = delta.hasNonNull("content") ? delta.get("content").asText() : textOrNull(choice, "text");
            String finish = textOrNull(choice, "finish_reason");
            return StreamChunk.builder()
                    .role(textOrNull(delta, "role"))
                    .content(content)
                    .finishReason(finish)
                    .usage(usage(node))
                    .terminal(finish != null)
                    .build();
        }

        JsonNode message = node.get("message");
        if (message != null && message.isObject()) {
            return doneAware(node, textOrNull(message, "content"), ollamaUsage(node));
        }

        for (String field : SIMPLE_CONTENT_FIELDS) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode()) {
                return doneAware(node, value.asText(), usage(node));
            }
        }

        if (type == AdapterType.PROXY) {
            return StreamChunk.delta(rawChunk);
        }
        return StreamChunk.error(ErrorKind.MALFORMED_UPSTREAM_RESPONSE,
                type + " sent a chunk with no recognizable content: " + Sanitizer.snapshot(data));
    }

    private StreamChunk doneAware(JsonNode node, String content, ChatModels.Usage usage) {
        String finish = textOrNull(node, "done_reason");
        if (finish == null) {
            finish = textOrNull(node, "finish_reason");
        }
        boolean done = node.path("done").asBoolean(false) || finish != null;
        return StreamChunk.builder()
                .content(content)
                .finishReason(done ? (finish != null ? finish : "stop") : null)
                .usage(usage)
                .terminal(done)
                .build();
    }

    private NormalizedResult text(String content, AdapterRequest request) {
        return NormalizedResult.builder()
                .id(request.getRequestId())
                .model(request.getExternalModelId())
                .nativeModel(request.getNativeModelId())
                .content(content)
                .finishReason("stop")
                .build();
    }

    private NormalizedResult result(AdapterRequest request, JsonNode node, String content,
                                    String finishReason, ChatModels.Usage usage) {
        String upstreamId = textOrNull(node, "id");
        return NormalizedResult.builder()
                .id(upstreamId != null ? upstreamId : request.getRequestId())
                .model(request.getExternalModelId())
                .nativeModel(request.getNativeModelId())
                .content(content != null ? content : "")
                .finishReason(finishReason != null ? finishReason : "stop")
                .usage(usage)
                .build();
    }

    private ChatModels.Usage usage(JsonNode node) {
        JsonNode usage = node.get("usage");
        if (usage == null || !usage.isObject()) {
            return null;
        }
        Integer prompt = intOrNull(usage, "prompt_tokens");
        Integer completion = intOrNull(usage, "completion_tokens");
        Integer total = intOrNull(usage, "total_tokens");
        if (prompt == null && completion == null && total == null) {
            return null;
        }
        if (total == null && prompt != null && completion != null) {
            total = prompt + completion;
        }
        return ChatModels.Usage.builder()
                .promptTokens(prompt)
                .completionTokens(completion)
                .totalTokens(total)
                .build();
    }

    private ChatModels.Usage ollamaUsage(JsonNode node) {
        Integer prompt = intOrNull(node, "prompt_eval_count");
        Integer completion = intOrNull(node, "eval_count");
        if (prompt == null && completion == null) {
            return usage(node);
        }
        return ChatModels.Usage.builder()
                .promptTokens(prompt)
                .completionTokens(completion)
                .totalTokens(prompt != null && completion != null ? prompt + completion : null)
                .build();
    }

    private String errorMessage(JsonNode error) {
        if (error.isTextual()) {
            return Sanitizer.snapshot(error.asText());
        }
        if (error.hasNonNull("message")) {
            return Sanitizer.snapshot(error.get("message").asText());
        }
        return Sanitizer.snapshot(error.toString());
    }

    private JsonNode parse(String body) {
        String trimmed = body.trim();
        if (trimmed.isEmpty() || (trimmed.charAt(0) != '{' && trimmed.charAt(0) != '[')) {
            return null;
        }
        try {
            return objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            log.trace("Not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Integer intOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || !value.isNumber() ? null : value.asInt();
    }

    private static String stripTrailingNewline(String text) {
        String result = text;
        while (result.endsWith("\n") || result.endsWith("\r")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
