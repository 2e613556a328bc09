package com.providergateway.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder(toBuilder = true)
public class HttpSdkConfig implements AdapterConfig {

    public enum AuthType { API_KEY, OAUTH, ROLE_BASED }

    /**
     * May contain a {@code {region}} placeholder.
     */
    String baseUrl;

    @Builder.Default
    AuthType authType = AuthType.API_KEY;

    String region;
    String modelPrefix;

    @Builder.Default
    String chatPath = "/chat/completions";

    /**
     * Blank means probes send a one-token completion instead of a GET.
     */
    @Builder.Default
    String healthPath = "/models";

    @Builder.Default
    String apiKeyHeader = "Authorization";

    String tokenUrl;
    String scope;

    @Singular
    Map<String, String> headers;

    @Builder.Default
    int timeoutSeconds = 30;

    @Override
    public AdapterType type() {
        return AdapterType.HTTP_SDK;
    }

    public String resolvedBaseUrl() {
        if (baseUrl == null || region == null) {
            return baseUrl;
        }
        return baseUrl.replace("{region}", region);
    }
}
