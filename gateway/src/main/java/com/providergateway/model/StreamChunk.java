package com.providergateway.model;

import com.providergateway.error.ErrorKind;
import lombok.Builder;
import lombok.Value;

/**
 * One incremental unit of a streamed completion. A well-formed stream ends with
 * exactly one terminal chunk: a finish chunk or an error chunk.
 */
@Value
@Builder(toBuilder = true)
public class StreamChunk {
    long index;
    String role;
    String content;
    String finishReason;
    ChatModels.Usage usage;
    ErrorKind errorKind;
    String errorMessage;
    boolean terminal;

    public static StreamChunk delta(String content) {
        return StreamChunk.builder().content(content).build();
    }

    public static StreamChunk finish(String finishReason, ChatModels.Usage usage) {
        return StreamChunk.builder()
                .finishReason(finishReason != null ? finishReason : "stop")
                .usage(usage)
                .terminal(true)
                .build();
    }

    public static StreamChunk error(ErrorKind kind, String message) {
        return StreamChunk.builder()
                .errorKind(kind)
                .errorMessage(message)
                .finishReason("error")
                .terminal(true)
                .build();
    }

    public boolean isError() {
        return errorKind != null;
    }

    public StreamChunk withIndex(long index) {
        return toBuilder().index(index).build();
    }
}
