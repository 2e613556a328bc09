package com.providergateway.adapter;

import com.providergateway.adapter.auth.ProviderCredentials;
import com.providergateway.error.AdapterException;
import com.providergateway.error.ErrorKind;
import com.providergateway.model.AdapterType;
import com.providergateway.model.Provider;
import com.providergateway.model.ProxyConfig;
import com.providergateway.service.ResponseNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Near-verbatim passthrough to an OpenAI-compatible upstream. Only {@code model}
 * and {@code stream} are rewritten; the client's credentials never leave the
 * gateway.
 */
public class ProxyAdapter extends AbstractHttpAdapter {

    private static final Set<String> NEVER_FORWARDED = Set.of(
            "authorization", "proxy-authorization", "x-api-key", "cookie", "host", "content-length");

    private final ProxyConfig config;
    private final String upstreamKey;
    private final Set<String> forwardHeaders;

    public ProxyAdapter(Provider provider, WebClient webClient, ProviderCredentials credentials,
                        ResponseNormalizer normalizer, MeterRegistry meterRegistry) {
        super(provider, webClient, normalizer, meterRegistry);
        this.config = (ProxyConfig) provider.getAdapterConfig();
        this.upstreamKey = credentials.get(ProviderCredentials.API_KEY).orElse(null);
        this.forwardHeaders = config.getForwardHeaders().stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .filter(name -> !NEVER_FORWARDED.contains(name))
                .collect(Collectors.toSet());
    }

    @Override
    public AdapterType getType() {
        return AdapterType.PROXY;
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
    protected String contentPointer() {
        return config.isTransformsEnabled() ? config.getResponseContentPointer() : null;
    }

    @Override
    protected Map<String, Object> buildBody(AdapterRequest request, boolean stream) {
        if (request.getRawBody() == null) {
            return openAiBody(request.getNativeModelId(), request, stream);
        }
        Map<String, Object> body = new LinkedHashMap<>(request.getRawBody());
        body.put("model", request.getNativeModelId());
        body.put("stream", stream);
        if (config.isTransformsEnabled()) {
            body.putAll(config.getRequestOverrides());
        }
        return body;
    }

    @Override
    protected Mono<HttpHeaders> requestHeaders(AdapterRequest request) {
        if (upstreamKey == null) {
            return Mono.error(new AdapterException(ErrorKind.CONFIGURATION_INVALID,
                    "No apiKey credential for provider " + provider.getSlug()));
        }
        HttpHeaders headers = new HttpHeaders();
        request.getForwardedHeaders().forEach((name, value) -> {
            if (forwardHeaders.contains(name.toLowerCase(Locale.ROOT))) {
                headers.set(name, value);
            }
        });
        headers.set(config.getApiKeyHeaderName(), config.effectiveKeyPrefix() + upstreamKey);
        return Mono.just(headers);
    }
}
