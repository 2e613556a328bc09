package com.providergateway.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.providergateway.adapter.auth.CredentialResolver;
import com.providergateway.adapter.auth.ProviderCredentials;
import com.providergateway.adapter.process.DirectProcessLauncher;
import com.providergateway.adapter.process.DockerProcessLauncher;
import com.providergateway.model.HttpSdkConfig;
import com.providergateway.model.LocalConfig;
import com.providergateway.model.Provider;
import com.providergateway.model.ProxyConfig;
import com.providergateway.model.SpawnCliConfig;
import com.providergateway.service.ResponseNormalizer;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Builds the adapter for a validated provider. Credentials are resolved here and
 * live only inside the adapter.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdapterFactory {

    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    private final WebClient.Builder webClientBuilder;
    private final CredentialResolver credentialResolver;
    private final ResponseNormalizer normalizer;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final BulkheadRegistry bulkheadRegistry;
    private final DirectProcessLauncher directLauncher;
    private final DockerProcessLauncher dockerLauncher;

    public ProviderAdapter create(Provider provider) {
        log.debug("Building {} adapter for provider {}", provider.getType(), provider.getSlug());
        switch (provider.getType()) {
            case SPAWN_CLI: {
                SpawnCliConfig config = (SpawnCliConfig) provider.getAdapterConfig();
                return new SpawnCliAdapter(provider, config.isSandboxed() ? dockerLauncher : directLauncher,
                        normalizer, objectMapper, meterRegistry);
            }
            case HTTP_SDK: {
                HttpSdkConfig config = (HttpSdkConfig) provider.getAdapterConfig();
                ProviderCredentials credentials = credentialResolver.resolve(provider);
                return new HttpSdkAdapter(provider, webClient(config.resolvedBaseUrl()), credentials,
                        normalizer, meterRegistry);
            }
            case PROXY: {
                ProxyConfig config = (ProxyConfig) provider.getAdapterConfig();
                ProviderCredentials credentials = credentialResolver.resolve(provider);
                return new ProxyAdapter(provider, webClient(config.getProxyBaseUrl()), credentials,
                        normalizer, meterRegistry);
            }
            case LOCAL: {
                LocalConfig config = (LocalConfig) provider.getAdapterConfig();
                return new LocalAdapter(provider, webClient(config.getEndpoint()), bulkheadRegistry,
                        normalizer, meterRegistry);
            }
            default:
                throw new IllegalArgumentException("Unsupported adapter type: " + provider.getType());
        }
    }

    private WebClient webClient(String baseUrl) {
        return webClientBuilder.clone()
                .baseUrl(baseUrl)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();
    }
}
