package com.providergateway.adapter.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.providergateway.error.AdapterException;
import com.providergateway.error.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client-credentials grant with a shared cached token. The token is reused until
 * {@link #EXPIRY_SKEW} before it expires; failures are not cached.
 */
@Slf4j
public class OAuthTokenProvider {

    static final Duration EXPIRY_SKEW = Duration.ofSeconds(60);
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final Mono<String> token;

    public OAuthTokenProvider(WebClient webClient, String tokenUrl, String scope, ProviderCredentials credentials) {
        String clientId = credentials.get(ProviderCredentials.CLIENT_ID).orElseThrow(() ->
                new AdapterException(ErrorKind.CONFIGURATION_INVALID, "oauth requires credential " + ProviderCredentials.CLIENT_ID));
        String clientSecret = credentials.get(ProviderCredentials.CLIENT_SECRET).orElseThrow(() ->
                new AdapterException(ErrorKind.CONFIGURATION_INVALID, "oauth requires credential " + ProviderCredentials.CLIENT_SECRET));

        this.token = Mono.defer(() -> {
                    var form = BodyInserters.fromFormData("grant_type", "client_credentials")
                            .with("client_id", clientId)
                            .with("client_secret", clientSecret);
                    if (scope != null && !scope.isBlank()) {
                        form = form.with("scope", scope);
                    }
                    return webClient.post()
                            .uri(tokenUrl)
                            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                            .body(form)
                            .retrieve()
                            .bodyToMono(JsonNode.class);
                })
                .map(this::toToken)
                .doOnNext(issued -> log.debug("Acquired oauth token from {} valid for {}s", tokenUrl, issued.expiresIn.getSeconds()))
                .cache(issued -> ttl(issued.expiresIn), error -> Duration.ZERO, () -> Duration.ZERO)
                .map(issued -> issued.value);
    }

    public Mono<String> getToken() {
        return token;
    }

    private IssuedToken toToken(JsonNode body) {
        JsonNode accessToken = body.get("access_token");
        if (accessToken == null || accessToken.asText().isBlank()) {
            throw AdapterException.malformed("Token endpoint response has no access_token", null);
        }
        long expiresIn = body.path("expires_in").asLong(DEFAULT_EXPIRES_IN_SECONDS);
        return new IssuedToken(accessToken.asText(), Duration.ofSeconds(expiresIn));
    }

    static Duration ttl(Duration expiresIn) {
        Duration ttl = expiresIn.minus(EXPIRY_SKEW);
        return ttl.isNegative() ? Duration.ZERO : ttl;
    }

    private record IssuedToken(String value, Duration expiresIn) {
    }
}
