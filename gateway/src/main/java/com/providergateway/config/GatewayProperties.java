package com.providergateway.config;

import com.providergateway.model.ProviderDefinition;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * Providers loaded into the registry at startup.
     */
    private List<ProviderDefinition> providers = new ArrayList<>();

    /**
     * Credential material per provider id or slug. Values prefixed with
     * {@code enc:} are decrypted with {@link SecretsSettings#getMasterKey()}.
     */
    private Map<String, Map<String, String>> credentials = new LinkedHashMap<>();

    private DispatchSettings dispatch = new DispatchSettings();
    private HealthSettings health = new HealthSettings();
    private StreamingSettings streaming = new StreamingSettings();
    private SandboxSettings sandbox = new SandboxSettings();
    private SecretsSettings secrets = new SecretsSettings();
    private RateLimitSettings rateLimit = new RateLimitSettings();
    private CacheSettings cache = new CacheSettings();

    public enum ConflictPolicy { MOST_RECENTLY_ENABLED, REJECT }

    @Data
    public static class DispatchSettings {
        private int defaultTimeoutSeconds = 60;
        private long safetyMarginMillis = 250;
        private ConflictPolicy conflictPolicy = ConflictPolicy.MOST_RECENTLY_ENABLED;
        private boolean fallbackEnabled = false;
        private int maxFallbacks = 1;
    }

    @Data
    public static class HealthSettings {
        private boolean enabled = true;
        private long intervalMillis = 30_000;
        private long initialDelayMillis = 5_000;
        private int probeTimeoutSeconds = 10;
        private int unhealthyThreshold = 3;
        private int historySize = 20;
        private boolean persist = true;
    }

    @Data
    public static class StreamingSettings {
        private long cancelGraceMillis = 500;
    }

    @Data
    public static class SandboxSettings {
        private String dockerBinary = "docker";
        private String defaultImage = "alpine:latest";
        private String memoryLimit = "512m";
        private String cpuLimit = "0.5";
        private String network = "none";
        private String user = "nobody";
        private String containerWorkDir = "/work";
        /**
         * Parent of per-run working directories; the system temp dir when unset.
         */
        private String workDirRoot;
    }

    @Data
    public static class SecretsSettings {
        /**
         * Base64 AES key used for {@code enc:} credential values.
         */
        private String masterKey;
    }

    @Data
    public static class RateLimitSettings {
        private boolean enabled = true;
        private int requestsPerMinute = 60;
    }

    @Data
    public static class CacheSettings {
        private boolean enabled = false;
        private int ttlSeconds = 3600;
    }
}
