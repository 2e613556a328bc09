package com.providergateway.adapter.auth;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Decrypted credential material for one provider. {@link #toString()} lists key
 * names only.
 */
public final class ProviderCredentials {

    public static final String API_KEY = "apiKey";
    public static final String CLIENT_ID = "clientId";
    public static final String CLIENT_SECRET = "clientSecret";
    public static final String TOKEN = "token";
    public static final String TOKEN_FILE = "tokenFile";
    public static final String TOKEN_ENV = "tokenEnv";

    public static final ProviderCredentials EMPTY = new ProviderCredentials(Map.of());

    private final Map<String, String> values;

    public ProviderCredentials(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public Optional<String> get(String name) {
        String value = values.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "ProviderCredentials" + values.keySet();
    }
}
