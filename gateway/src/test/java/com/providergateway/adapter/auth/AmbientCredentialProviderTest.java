package com.providergateway.adapter.auth;

import com.providergateway.error.ErrorKind;
import com.providergateway.error.GatewayException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AmbientCredentialProviderTest {

    @TempDir
    Path tempDir;

    @Test
    void tokenFileIsReadOnEveryCall() throws Exception {
        Path file = tempDir.resolve("token");
        Files.writeString(file, "first\n");
        AmbientCredentialProvider provider = new AmbientCredentialProvider(new ProviderCredentials(Map.of(
                ProviderCredentials.TOKEN_FILE, file.toString(),
                ProviderCredentials.TOKEN, "inline")));

        StepVerifier.create(provider.getToken()).expectNext("first").verifyComplete();
        Files.writeString(file, "rotated");
        StepVerifier.create(provider.getToken()).expectNext("rotated").verifyComplete();
    }

    @Test
    void environmentVariableComesBeforeInlineToken() {
        AmbientCredentialProvider provider = new AmbientCredentialProvider(new ProviderCredentials(Map.of(
                ProviderCredentials.TOKEN_ENV, "WORKLOAD_TOKEN",
                ProviderCredentials.TOKEN, "inline")),
                Map.of("WORKLOAD_TOKEN", " from-env ")::get);

        StepVerifier.create(provider.getToken()).expectNext("from-env").verifyComplete();
    }

    @Test
    void unsetVariableIsAConfigurationError() {
        AmbientCredentialProvider provider = new AmbientCredentialProvider(new ProviderCredentials(Map.of(
                ProviderCredentials.TOKEN_ENV, "WORKLOAD_TOKEN")), name -> null);

        StepVerifier.create(provider.getToken())
                .expectErrorSatisfies(error -> assertThat(((GatewayException) error).getKind())
                        .isEqualTo(ErrorKind.CONFIGURATION_INVALID))
                .verify();
    }

    @Test
    void missingFileIsAConfigurationError() {
        AmbientCredentialProvider provider = new AmbientCredentialProvider(new ProviderCredentials(Map.of(
                ProviderCredentials.TOKEN_FILE, tempDir.resolve("absent").toString())));

        StepVerifier.create(provider.getToken())
                .expectErrorSatisfies(error -> assertThat(((GatewayException) error).getKind())
                        .isEqualTo(ErrorKind.CONFIGURATION_INVALID))
                .verify();
    }

    @Test
    void nothingConfiguredFails() {
        StepVerifier.create(new AmbientCredentialProvider(ProviderCredentials.EMPTY).getToken())
                .expectError(GatewayException.class)
                .verify();
    }
}
