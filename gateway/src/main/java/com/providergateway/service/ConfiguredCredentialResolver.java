package com.providergateway.service;

import com.providergateway.adapter.auth.CredentialResolver;
import com.providergateway.adapter.auth.ProviderCredentials;
import com.providergateway.config.GatewayProperties;
import com.providergateway.error.GatewayException;
import com.providergateway.error.ErrorKind;
import com.providergateway.model.Provider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads credentials from {@code gateway.credentials.<provider id or slug>}.
 * Values written as {@code enc:<base64>} hold a 12-byte IV followed by the
 * AES-GCM ciphertext and tag, under {@code gateway.secrets.master-key}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfiguredCredentialResolver implements CredentialResolver {

    static final String ENCRYPTED_PREFIX = "enc:";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private final GatewayProperties properties;

    @Override
    public ProviderCredentials resolve(Provider provider) {
        Map<String, String> raw = properties.getCredentials().get(provider.getId());
        if (raw == null) {
            raw = properties.getCredentials().get(provider.getSlug());
        }
        if (raw == null || raw.isEmpty()) {
            return ProviderCredentials.EMPTY;
        }
        Map<String, String> resolved = new LinkedHashMap<>();
        raw.forEach((name, value) -> resolved.put(name, decode(provider, name, value)));
        log.debug("Resolved credentials {} for provider {}", resolved.keySet(), provider.getSlug());
        return new ProviderCredentials(resolved);
    }

    private String decode(Provider provider, String name, String value) {
        if (value == null || !value.startsWith(ENCRYPTED_PREFIX)) {
            return value;
        }
        try {
            return decrypt(value.substring(ENCRYPTED_PREFIX.length()), masterKey());
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new GatewayException(ErrorKind.CONFIGURATION_INVALID,
                    "Credential '" + name + "' of provider " + provider.getSlug() + " cannot be decrypted", e);
        }
    }

    private byte[] masterKey() {
        String key = properties.getSecrets().getMasterKey();
        if (key == null || key.isBlank()) {
            throw new GatewayException(ErrorKind.CONFIGURATION_INVALID,
                    "Encrypted credentials require gateway.secrets.master-key");
        }
        return Base64.getDecoder().decode(key.trim());
    }

    static String decrypt(String payload, byte[] key) throws GeneralSecurityException {
        byte[] bytes = Base64.getDecoder().decode(payload);
        if (bytes.length <= IV_LENGTH) {
            throw new GeneralSecurityException("Encrypted value is too short");
        }
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                new GCMParameterSpec(TAG_BITS, Arrays.copyOfRange(bytes, 0, IV_LENGTH)));
        byte[] plain = cipher.doFinal(bytes, IV_LENGTH, bytes.length - IV_LENGTH);
        return new String(plain, StandardCharsets.UTF_8);
    }

    /**
     * Produces an {@code enc:} value for configuration files.
     */
    public static String encrypt(String plain, byte[] key) throws GeneralSecurityException {
        byte[] iv = new byte[IV_LENGTH];
        new SecureRandom().nextBytes(iv);
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, iv));
        byte[] sealed = cipher.doFinal(plain.getBytes(StandardCharsets.UTF_8));
        byte[] out = new byte[IV_LENGTH + sealed.length];
        System.arraycopy(iv, 0, out, 0, IV_LENGTH);
        System.arraycopy(sealed, 0, out, IV_LENGTH, sealed.length);
        return ENCRYPTED_PREFIX + Base64.getEncoder().encodeToString(out);
    }
}
