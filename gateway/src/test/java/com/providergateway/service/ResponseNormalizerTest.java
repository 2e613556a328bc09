package com.providergateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.providergateway.adapter.AdapterRequest;
import com.providergateway.error.AdapterException;
import com.providergateway.error.ErrorKind;
import com.providergateway.model.AdapterType;
import com.providergateway.model.NormalizedResult;
import com.providergateway.model.StreamChunk;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseNormalizerTest {

    private final ResponseNormalizer normalizer = new ResponseNormalizer(new ObjectMapper());

    private final AdapterRequest request = AdapterRequest.builder()
            .requestId("req-1")
            .externalModelId("gpt-test")
            .nativeModelId("native-gpt")
            .deadline(Instant.now().plusSeconds(30))
            .build();

    @Test
    void openAiCompletion() {
        String raw = "{\"id\":\"cmpl-9\",\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"Hi there\"},"
                + "\"finish_reason\":\"length\"}],\"usage\":{\"prompt_tokens\":3,\"completion_tokens\":2}}";

        NormalizedResult result = normalizer.normalize(AdapterType.HTTP_SDK, raw, request);

        assertThat(result.getId()).isEqualTo("cmpl-9");
        assertThat(result.getContent()).isEqualTo("Hi there");
        assertThat(result.getFinishReason()).isEqualTo("length");
        assertThat(result.getModel()).isEqualTo("gpt-test");
        assertThat(result.getUsage().getTotalTokens()).isEqualTo(5);
    }

    @Test
    void ollamaChatResponse() {
        String raw = "{\"model\":\"llama3\",\"message\":{\"role\":\"assistant\",\"content\":\"hello\"},"
                + "\"done\":true,\"prompt_eval_count\":7,\"eval_count\":4}";

        NormalizedResult result = normalizer.normalize(AdapterType.LOCAL, raw, request);

        assertThat(result.getContent()).isEqualTo("hello");
        assertThat(result.getFinishReason()).isEqualTo("stop");
        assertThat(result.getId()).isEqualTo("req-1");
        assertThat(result.getUsage().getPromptTokens()).isEqualTo(7);
        assertThat(result.getUsage().getCompletionTokens()).isEqualTo(4);
    }

    @Test
    void usageIsAbsentWhenNotReported() {
        NormalizedResult result = normalizer.normalize(AdapterType.HTTP_SDK, "{\"output\":\"done\"}", request);

        assertThat(result.getContent()).isEqualTo("done");
        assertThat(result.getUsage()).isNull();
    }

    @Test
    void plainCliOutputBecomesContent() {
        NormalizedResult result = normalizer.normalize(AdapterType.SPAWN_CLI, "hello world\n", request);

        assertThat(result.getContent()).isEqualTo("hello world");
        assertThat(result.getFinishReason()).isEqualTo("stop");
    }

    @Test
    void proxyContentPointer() {
        NormalizedResult result = normalizer.normalize(AdapterType.PROXY,
                "{\"output\":{\"text\":\"pointed\"}}", request, "/output/text");

        assertThat(result.getContent()).isEqualTo("pointed");
    }

    @Test
    void nonJsonFromHttpProviderIsMalformed() {
        assertThatThrownBy(() -> normalizer.normalize(AdapterType.HTTP_SDK, "<html>bad gateway</html>", request))
                .isInstanceOf(AdapterException.class)
                .extracting("kind").isEqualTo(ErrorKind.MALFORMED_UPSTREAM_RESPONSE);
    }

    @Test
    void errorObjectIsUpstreamError() {
        assertThatThrownBy(() -> normalizer.normalize(AdapterType.HTTP_SDK,
                "{\"error\":{\"message\":\"model overloaded\"}}", request))
                .isInstanceOf(AdapterException.class)
                .extracting("kind").isEqualTo(ErrorKind.UPSTREAM_ERROR);
    }

    @Test
    void streamChunks() {
        StreamChunk delta = normalizer.normalizeChunk(AdapterType.HTTP_SDK,
                "{\"choices\":[{\"delta\":{\"content\":\"He\"}}]}");
        StreamChunk last = normalizer.normalizeChunk(AdapterType.HTTP_SDK,
                "{\"choices\":[{\"delta\":{},\"finish_reason\":\"stop\"}]}");

        assertThat(delta.getContent()).isEqualTo("He");
        assertThat(delta.isTerminal()).isFalse();
        assertThat(last.isTerminal()).isTrue();
        assertThat(last.getFinishReason()).isEqualTo("stop");
        assertThat(normalizer.normalizeChunk(AdapterType.HTTP_SDK, "[DONE]").isTerminal()).isTrue();
        assertThat(normalizer.normalizeChunk(AdapterType.HTTP_SDK, "   ")).isNull();
    }

    @Test
    void ollamaStreamLines() {
        StreamChunk partial = normalizer.normalizeChunk(AdapterType.LOCAL,
                "{\"message\":{\"role\":\"assistant\",\"content\":\"Hel\"},\"done\":false}");
        StreamChunk done = normalizer.normalizeChunk(AdapterType.LOCAL,
                "{\"message\":{\"role\":\"assistant\",\"content\":\"\"},\"done\":true,\"eval_count\":2}");

        assertThat(partial.isTerminal()).isFalse();
        assertThat(done.isTerminal()).isTrue();
        assertThat(done.getUsage().getCompletionTokens()).isEqualTo(2);
    }

    @Test
    void unparsableLineIsErrorChunkExceptForProxies() {
        StreamChunk cli = normalizer.normalizeChunk(AdapterType.SPAWN_CLI, "not json");
        StreamChunk proxy = normalizer.normalizeChunk(AdapterType.PROXY, "not json");

        assertThat(cli.isError()).isTrue();
        assertThat(cli.getErrorKind()).isEqualTo(ErrorKind.MALFORMED_UPSTREAM_RESPONSE);
        assertThat(proxy.isError()).isFalse();
        assertThat(proxy.getContent()).isEqualTo("not json");
    }
}
