package com.providergateway.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class ProxyConfig implements AdapterConfig {

    String proxyBaseUrl;

    @Builder.Default
    String apiKeyHeaderName = "Authorization";

    /**
     * Prepended to the upstream key; {@code "Bearer "} for the Authorization header.
     */
    String apiKeyPrefix;

    @Singular
    List<String> forwardHeaders;

    @Builder.Default
    String chatPath = "/v1/chat/completions";

    @Builder.Default
    String healthPath = "/v1/models";

    boolean transformsEnabled;

    @Singular
    Map<String, Object> requestOverrides;

    /**
     * JSON pointer to the content in a non-OpenAI response, e.g. {@code /output/text}.
     */
    String responseContentPointer;

    @Builder.Default
    int timeoutSeconds = 30;

    @Override
    public AdapterType type() {
        return AdapterType.PROXY;
    }

    public String effectiveKeyPrefix() {
        if (apiKeyPrefix != null) {
            return apiKeyPrefix;
        }
        return "authorization".equalsIgnoreCase(apiKeyHeaderName) ? "Bearer " : "";
    }
}
