package com.providergateway.adapter.auth;

import com.providergateway.error.AdapterException;
import com.providergateway.error.ErrorKind;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Function;

/**
 * Role-based auth: the credential belongs to the runtime environment, not to the
 * provider record. Resolved on every call so rotated token files are picked up.
 * Lookup order is a mounted token file, then a named environment variable, then
 * an inline token.
 */
public class AmbientCredentialProvider {

    private final ProviderCredentials credentials;
    private final Function<String, String> environment;

    public AmbientCredentialProvider(ProviderCredentials credentials) {
        this(credentials, System::getenv);
    }

    AmbientCredentialProvider(ProviderCredentials credentials, Function<String, String> environment) {
        this.credentials = credentials;
        this.environment = environment;
    }

    public Mono<String> getToken() {
        var tokenFile = credentials.get(ProviderCredentials.TOKEN_FILE);
        if (tokenFile.isPresent()) {
            Path path = Paths.get(tokenFile.get());
            return Mono.fromCallable(() -> readToken(path)).subscribeOn(Schedulers.boundedElastic());
        }
        var variable = credentials.get(ProviderCredentials.TOKEN_ENV);
        if (variable.isPresent()) {
            String value = environment.apply(variable.get());
            if (value == null || value.isBlank()) {
                return Mono.error(new AdapterException(ErrorKind.CONFIGURATION_INVALID,
                        "Environment variable " + variable.get() + " is not set"));
            }
            return Mono.just(value.trim());
        }
        return credentials.get(ProviderCredentials.TOKEN)
                .map(Mono::just)
                .orElseGet(() -> Mono.error(new AdapterException(ErrorKind.CONFIGURATION_INVALID,
                        "role-based auth needs one of tokenFile, tokenEnv or token")));
    }

    private static String readToken(Path path) {
        try {
            String token = Files.readString(path, StandardCharsets.UTF_8).trim();
            if (token.isEmpty()) {
                throw new AdapterException(ErrorKind.CONFIGURATION_INVALID, "Token file " + path + " is empty");
            }
            return token;
        } catch (IOException e) {
            throw new AdapterException(ErrorKind.CONFIGURATION_INVALID, "Cannot read token file " + path, e);
        }
    }
}
