package com.providergateway.adapter;

import com.providergateway.adapter.auth.AmbientCredentialProvider;
import com.providergateway.adapter.auth.OAuthTokenProvider;
import com.providergateway.adapter.auth.ProviderCredentials;
import com.providergateway.error.AdapterException;
import com.providergateway.error.ErrorKind;
import com.providergateway.model.AdapterType;
import com.providergateway.model.HttpSdkConfig;
import com.providergateway.model.Provider;
import com.providergateway.service.ResponseNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Calls a provider's own HTTP API with api-key, oauth client-credentials or
 * role-based auth. No automatic retries.
 */
@Slf4j
public class HttpSdkAdapter extends AbstractHttpAdapter {

    private final HttpSdkConfig config;
    private final ProviderCredentials credentials;
    private final OAuthTokenProvider oauthTokens;
    private final AmbientCredentialProvider ambientCredentials;

    public HttpSdkAdapter(Provider provider, WebClient webClient, ProviderCredentials credentials,
                          ResponseNormalizer normalizer, MeterRegistry meterRegistry) {
        super(provider, webClient, normalizer, meterRegistry);
        this.config = (HttpSdkConfig) provider.getAdapterConfig();
        this.credentials = credentials;
        this.oauthTokens = config.getAuthType() == HttpSdkConfig.AuthType.OAUTH
                ? new OAuthTokenProvider(webClient, config.getTokenUrl(), config.getScope(), credentials)
                : null;
        this.ambientCredentials = config.getAuthType() == HttpSdkConfig.AuthType.ROLE_BASED
                ? new AmbientCredentialProvider(credentials)
                : null;
    }

    @Override
    public AdapterType getType() {
        return AdapterType.HTTP_SDK;
    }

    @Override
    protected String chatPath() {
        return config.getChatPath();
    }

    @Override
    protected String healthPath() {
        return config.getHealthPath();
    }

    @Override
    protected Map<String, Object> buildBody(AdapterRequest request, boolean stream) {
        return openAiBody(prefixedModel(request.getNativeModelId()), request, stream);
    }

    String prefixedModel(String nativeModelId) {
        String prefix = config.getModelPrefix();
        if (prefix == null || prefix.isEmpty() || nativeModelId.startsWith(prefix)) {
            return nativeModelId;
        }
        return prefix + nativeModelId;
    }

    @Override
    protected Mono<HttpHeaders> requestHeaders(AdapterRequest request) {
        Mono<String> token;
        switch (config.getAuthType()) {
            case OAUTH:
                token = oauthTokens.getToken();
                break;
            case ROLE_BASED:
                token = ambientCredentials.getToken();
                break;
            case API_KEY:
            default:
                token = credentials.get(ProviderCredentials.API_KEY)
                        .map(Mono::just)
                        .orElseGet(() -> Mono.error(new AdapterException(ErrorKind.CONFIGURATION_INVALID,
                                "No apiKey credential for provider " + provider.getSlug())));
                break;
        }
        return token.map(value -> {
            HttpHeaders headers = new HttpHeaders();
            config.getHeaders().forEach(headers::set);
            if (config.getAuthType() == HttpSdkConfig.AuthType.API_KEY) {
                String header = config.getApiKeyHeader();
                headers.set(header, HttpHeaders.AUTHORIZATION.equalsIgnoreCase(header) ? "Bearer " + value : value);
            } else {
                headers.setBearerAuth(value);
            }
            return headers;
        });
    }
}
