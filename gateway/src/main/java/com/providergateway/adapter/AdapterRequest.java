package com.providergateway.adapter;

import com.providergateway.model.ChatModels;
import com.providergateway.model.GenerationParameters;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Per-call input handed to an adapter once the dispatcher has resolved the
 * provider and mapping.
 */
@Value
@Builder(toBuilder = true)
public class AdapterRequest {

    String requestId;
    String externalModelId;
    String nativeModelId;

    @Singular
    List<ChatModels.Message> messages;

    @Builder.Default
    GenerationParameters parameters = GenerationParameters.DEFAULTS;

    Instant deadline;

    /**
     * Inbound headers, lower-cased names. Only the proxy adapter reads them.
     */
    @Singular
    Map<String, String> forwardedHeaders;

    /**
     * Inbound request body as received, for verbatim forwarding.
     */
    Map<String, Object> rawBody;

    boolean probe;

    public Duration remaining() {
        return Duration.between(Instant.now(), deadline);
    }

    public boolean isExpired() {
        return !Instant.now().isBefore(deadline);
    }

    /**
     * Text of the last user message, or of the last message when none has the user role.
     */
    public String lastUserContent() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if ("user".equals(messages.get(i).getRole())) {
                return messages.get(i).getContent();
            }
        }
        return messages.isEmpty() ? "" : messages.get(messages.size() - 1).getContent();
    }
}
