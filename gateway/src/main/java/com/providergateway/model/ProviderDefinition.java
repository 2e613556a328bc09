package com.providergateway.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Untrusted provider description, as bound from configuration or posted to the
 * admin API. Only the section matching {@link #type} may be present; the
 * {@code ProviderConfigValidator} turns it into a {@link Provider}.
 */
@Data
public class ProviderDefinition {

    private String id;
    private String name;
    private String slug;
    private String type;
    private boolean enabled = true;

    private SpawnCliSettings spawnCli;
    private HttpSdkSettings httpSdk;
    private ProxySettings proxy;
    private LocalSettings local;

    private List<ModelSettings> models = new ArrayList<>();

    @Data
    public static class ModelSettings {
        private String externalId;
        private String nativeId;
        private Integer maxTokens;
        private Integer contextWindow;
        private Double costPerToken;
    }

    @Data
    public static class SpawnCliSettings {
        private String command;
        private List<String> args = new ArrayList<>();
        private String inputChannel;
        private String inputFormat;
        private String outputFormat;
        private Boolean sandboxed;
        private String sandboxImage;
        private String memoryLimit;
        private String cpuLimit;
        private Map<String, String> environment = new LinkedHashMap<>();
        private List<String> inheritEnvironment = new ArrayList<>();
        private Integer timeoutSeconds;
        private Long maxOutputBytes;
    }

    @Data
    public static class HttpSdkSettings {
        private String baseUrl;
        private String authType;
        private String region;
        private String modelPrefix;
        private String chatPath;
        private String healthPath;
        private String apiKeyHeader;
        private String tokenUrl;
        private String scope;
        private Map<String, String> headers = new LinkedHashMap<>();
        private Integer timeoutSeconds;
    }

    @Data
    public static class ProxySettings {
        private String proxyBaseUrl;
        private String apiKeyHeaderName;
        private String apiKeyPrefix;
        private List<String> forwardHeaders = new ArrayList<>();
        private String chatPath;
        private String healthPath;
        private boolean transformsEnabled;
        private Map<String, Object> requestOverrides = new LinkedHashMap<>();
        private String responseContentPointer;
        private Integer timeoutSeconds;
    }

    @Data
    public static class LocalSettings {
        private String endpoint;
        private String protocol;
        private Integer maxConcurrentRequests;
        private Long queueTimeoutMillis;
        private String chatPath;
        private String healthPath;
        private Integer timeoutSeconds;
    }
}
