package com.providergateway.service;

import com.providergateway.adapter.auth.ProviderCredentials;
import com.providergateway.config.GatewayProperties;
import com.providergateway.error.ErrorKind;
import com.providergateway.error.GatewayException;
import com.providergateway.model.Provider;
import com.providergateway.support.Definitions;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ConfiguredCredentialResolverTest {

    private static final byte[] KEY = "0123456789abcdef0123456789abcdef".getBytes();

    private final GatewayProperties properties = new GatewayProperties();
    private final ConfiguredCredentialResolver resolver = new ConfiguredCredentialResolver(properties);
    private final Provider provider = new ProviderConfigValidator()
            .validate(Definitions.httpSdk("openai", "https://api.example.com/v1"));

    @Test
    void plainValuesPassThrough() {
        properties.getCredentials().put("openai", Map.of(ProviderCredentials.API_KEY, "sk-plain"));

        assertThat(resolver.resolve(provider).get(ProviderCredentials.API_KEY)).contains("sk-plain");
    }

    @Test
    void encryptedValuesAreDecrypted() throws Exception {
        properties.getSecrets().setMasterKey(Base64.getEncoder().encodeToString(KEY));
        String sealed = ConfiguredCredentialResolver.encrypt("sk-sealed", KEY);
        properties.getCredentials().put("openai", Map.of(ProviderCredentials.API_KEY, sealed));

        ProviderCredentials credentials = resolver.resolve(provider);

        assertThat(sealed).startsWith("enc:").doesNotContain("sk-sealed");
        assertThat(credentials.get(ProviderCredentials.API_KEY)).contains("sk-sealed");
        assertThat(credentials.toString()).doesNotContain("sk-sealed");
    }

    @Test
    void encryptedValueWithoutMasterKeyIsInvalidConfiguration() throws Exception {
        properties.getCredentials().put("openai",
                Map.of(ProviderCredentials.API_KEY, ConfiguredCredentialResolver.encrypt("sk-sealed", KEY)));

        GatewayException error = catchThrowableOfType(() -> resolver.resolve(provider), GatewayException.class);

        assertThat(error.getKind()).isEqualTo(ErrorKind.CONFIGURATION_INVALID);
    }

    @Test
    void wrongMasterKeyIsInvalidConfiguration() throws Exception {
        properties.getSecrets().setMasterKey(Base64.getEncoder().encodeToString("fedcba9876543210fedcba9876543210".getBytes()));
        properties.getCredentials().put("openai",
                Map.of(ProviderCredentials.API_KEY, ConfiguredCredentialResolver.encrypt("sk-sealed", KEY)));

        GatewayException error = catchThrowableOfType(() -> resolver.resolve(provider), GatewayException.class);

        assertThat(error.getKind()).isEqualTo(ErrorKind.CONFIGURATION_INVALID);
        assertThat(error.getMessage()).doesNotContain("sk-sealed");
    }

    @Test
    void unknownProviderHasNoCredentials() {
        assertThat(resolver.resolve(provider).isEmpty()).isTrue();
    }
}
