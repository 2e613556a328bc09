package com.providergateway.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class LocalConfig implements AdapterConfig {

    public enum Protocol { OPENAI, OLLAMA }

    String endpoint;

    @Builder.Default
    Protocol protocol = Protocol.OPENAI;

    @Builder.Default
    int maxConcurrentRequests = 4;

    /**
     * How long a call may wait for a free slot before failing as overloaded.
     */
    @Builder.Default
    long queueTimeoutMillis = 250;

    String chatPath;
    String healthPath;

    @Builder.Default
    int timeoutSeconds = 60;

    @Override
    public AdapterType type() {
        return AdapterType.LOCAL;
    }

    public String effectiveChatPath() {
        if (chatPath != null && !chatPath.isBlank()) {
            return chatPath;
        }
        return protocol == Protocol.OLLAMA ? "/api/chat" : "/v1/chat/completions";
    }

    public String effectiveHealthPath() {
        if (healthPath != null && !healthPath.isBlank()) {
            return healthPath;
        }
        return protocol == Protocol.OLLAMA ? "/api/tags" : "/v1/models";
    }
}
