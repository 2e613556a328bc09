package com.providergateway.service;

import com.providergateway.error.InvalidConfigurationException;
import com.providergateway.model.AdapterConfig;
import com.providergateway.model.AdapterType;
import com.providergateway.model.HttpSdkConfig;
import com.providergateway.model.LocalConfig;
import com.providergateway.model.ModelMapping;
import com.providergateway.model.Provider;
import com.providergateway.model.ProviderDefinition;
import com.providergateway.model.ProxyConfig;
import com.providergateway.model.SpawnCliConfig;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns an untrusted {@link ProviderDefinition} into a {@link Provider}, or fails
 * with every violation found. Only the section matching the declared type may be
 * present.
 */
@Component
public class ProviderConfigValidator {

    public static final Pattern SLUG = Pattern.compile("^[a-z0-9]+(-[a-z0-9]+)*$");

    private static final Pattern ENV_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
    private static final Pattern MEMORY_LIMIT = Pattern.compile("^\\d+[kmgKMG]?$");
    private static final Pattern CPU_LIMIT = Pattern.compile("^\\d*\\.?\\d+$");
    private static final Pattern HEADER_NAME = Pattern.compile("^[A-Za-z0-9-]+$");
    private static final int MAX_NAME_LENGTH = 100;
    private static final int MAX_SLUG_LENGTH = 50;
    private static final int MAX_TIMEOUT_SECONDS = 3600;
    private static final int MAX_TOKENS_LIMIT = 1_000_000;
    private static final int MAX_LOCAL_CONCURRENCY = 1024;

    public Provider validate(ProviderDefinition definition) {
        List<String> errors = new ArrayList<>();
        String subject = "provider '" + (definition.getSlug() != null ? definition.getSlug() : definition.getName()) + "'";

        if (isBlank(definition.getName())) {
            errors.add("name is required");
        } else if (definition.getName().length() > MAX_NAME_LENGTH) {
            errors.add("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (isBlank(definition.getSlug())) {
            errors.add("slug is required");
        } else if (!SLUG.matcher(definition.getSlug()).matches() || definition.getSlug().length() > MAX_SLUG_LENGTH) {
            errors.add("slug must match " + SLUG.pattern() + " and be at most " + MAX_SLUG_LENGTH + " characters");
        }

        AdapterType type = null;
        if (isBlank(definition.getType())) {
            errors.add("type is required");
        } else {
            try {
                type = AdapterType.fromWireName(definition.getType());
            } catch (IllegalArgumentException e) {
                errors.add("type must be one of spawn-cli, http-sdk, proxy, local");
            }
        }

        List<ModelMapping> models = validateModels(definition.getModels(), errors);

        AdapterConfig adapterConfig = null;
        if (type != null) {
            checkOnlySection(definition, type, errors);
            switch (type) {
                case SPAWN_CLI:
                    adapterConfig = spawnCli(definition.getSpawnCli(), errors);
                    break;
                case HTTP_SDK:
                    adapterConfig = httpSdk(definition.getHttpSdk(), errors);
                    break;
                case PROXY:
                    adapterConfig = proxy(definition.getProxy(), errors);
                    break;
                case LOCAL:
                    adapterConfig = local(definition.getLocal(), errors);
                    break;
                default:
                    errors.add("unsupported type " + type);
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException(subject, errors);
        }

        return Provider.builder()
                .id(isBlank(definition.getId()) ? definition.getSlug() : definition.getId())
                .name(definition.getName().trim())
                .slug(definition.getSlug())
                .enabled(definition.isEnabled())
                .adapterConfig(adapterConfig)
                .models(models)
                .build();
    }

    private void checkOnlySection(ProviderDefinition definition, AdapterType type, List<String> errors) {
        Map<AdapterType, Object> sections = new EnumMap<>(AdapterType.class);
        sections.put(AdapterType.SPAWN_CLI, definition.getSpawnCli());
        sections.put(AdapterType.HTTP_SDK, definition.getHttpSdk());
        sections.put(AdapterType.PROXY, definition.getProxy());
        sections.put(AdapterType.LOCAL, definition.getLocal());
        sections.forEach((sectionType, section) -> {
            if (section == null && sectionType == type) {
                errors.add(type + " configuration section is required");
            } else if (section != null && sectionType != type) {
                errors.add(sectionType + " configuration is not allowed for a " + type + " provider");
            }
        });
    }

    private List<ModelMapping> validateModels(List<ProviderDefinition.ModelSettings> settings, List<String> errors) {
        List<ModelMapping> models = new ArrayList<>();
        if (settings == null) {
            return models;
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < settings.size(); i++) {
            ProviderDefinition.ModelSettings model = settings.get(i);
            String prefix = "models[" + i + "]";
            if (isBlank(model.getExternalId())) {
                errors.add(prefix + ".externalId is required");
            } else if (!seen.add(model.getExternalId().trim())) {
                errors.add(prefix + ".externalId '" + model.getExternalId() + "' is mapped twice");
            }
            if (isBlank(model.getNativeId())) {
                errors.add(prefix + ".nativeId is required");
            }
            checkRange(model.getMaxTokens(), 1, MAX_TOKENS_LIMIT, prefix + ".maxTokens", errors);
            checkRange(model.getContextWindow(), 1, MAX_TOKENS_LIMIT, prefix + ".contextWindow", errors);
            if (model.getCostPerToken() != null && model.getCostPerToken() < 0) {
                errors.add(prefix + ".costPerToken must not be negative");
            }
            if (!isBlank(model.getExternalId()) && !isBlank(model.getNativeId())) {
                models.add(ModelMapping.builder()
                        .externalId(model.getExternalId().trim())
                        .nativeId(model.getNativeId().trim())
                        .maxTokens(model.getMaxTokens())
                        .contextWindow(model.getContextWindow())
                        .costPerToken(model.getCostPerToken())
                        .build());
            }
        }
        return models;
    }

    private SpawnCliConfig spawnCli(ProviderDefinition.SpawnCliSettings settings, List<String> errors) {
        if (settings == null) {
            return null;
        }
        SpawnCliConfig.SpawnCliConfigBuilder builder = SpawnCliConfig.builder();
        if (isBlank(settings.getCommand())) {
            errors.add("spawnCli.command is required");
        } else {
            builder.command(settings.getCommand().trim());
        }
        if (settings.getArgs() != null) {
            builder.args(settings.getArgs());
        }
        builder.inputChannel(parseEnum(SpawnCliConfig.InputChannel.class, settings.getInputChannel(),
                SpawnCliConfig.InputChannel.STDIN, "spawnCli.inputChannel", errors));
        builder.inputFormat(parseEnum(SpawnCliConfig.InputFormat.class, settings.getInputFormat(),
                SpawnCliConfig.InputFormat.JSON, "spawnCli.inputFormat", errors));
        builder.outputFormat(parseEnum(SpawnCliConfig.OutputFormat.class, settings.getOutputFormat(),
                SpawnCliConfig.OutputFormat.TEXT, "spawnCli.outputFormat", errors));
        builder.sandboxed(settings.getSandboxed() == null || settings.getSandboxed());
        builder.sandboxImage(settings.getSandboxImage());
        if (settings.getMemoryLimit() != null && !MEMORY_LIMIT.matcher(settings.getMemoryLimit()).matches()) {
            errors.add("spawnCli.memoryLimit must look like 512m");
        }
        builder.memoryLimit(settings.getMemoryLimit());
        if (settings.getCpuLimit() != null && !CPU_LIMIT.matcher(settings.getCpuLimit()).matches()) {
            errors.add("spawnCli.cpuLimit must be a positive number");
        }
        builder.cpuLimit(settings.getCpuLimit());
        if (settings.getEnvironment() != null) {
            settings.getEnvironment().forEach((name, value) -> {
                if (!ENV_NAME.matcher(name).matches()) {
                    errors.add("spawnCli.environment name '" + name + "' is not a valid variable name");
                }
            });
            builder.environment(settings.getEnvironment());
        }
        if (settings.getInheritEnvironment() != null) {
            for (String name : settings.getInheritEnvironment()) {
                if (name == null || !ENV_NAME.matcher(name).matches()) {
                    errors.add("spawnCli.inheritEnvironment entry '" + name + "' is not a valid variable name");
                }
            }
            builder.inheritEnvironment(settings.getInheritEnvironment());
        }
        if (settings.getTimeoutSeconds() != null) {
            checkRange(settings.getTimeoutSeconds(), 1, MAX_TIMEOUT_SECONDS, "spawnCli.timeoutSeconds", errors);
            builder.timeoutSeconds(settings.getTimeoutSeconds());
        }
        if (settings.getMaxOutputBytes() != null) {
            if (settings.getMaxOutputBytes() <= 0) {
                errors.add("spawnCli.maxOutputBytes must be positive");
            }
            builder.maxOutputBytes(settings.getMaxOutputBytes());
        }
        return builder.build();
    }

    private HttpSdkConfig httpSdk(ProviderDefinition.HttpSdkSettings settings, List<String> errors) {
        if (settings == null) {
            return null;
        }
        HttpSdkConfig.HttpSdkConfigBuilder builder = HttpSdkConfig.builder();
        HttpSdkConfig.AuthType authType = parseEnum(HttpSdkConfig.AuthType.class, settings.getAuthType(),
                HttpSdkConfig.AuthType.API_KEY, "httpSdk.authType", errors);
        builder.authType(authType);
        builder.region(settings.getRegion());
        if (isBlank(settings.getBaseUrl())) {
            errors.add("httpSdk.baseUrl is required");
        } else {
            String baseUrl = settings.getBaseUrl().trim();
            if (baseUrl.contains("{region}")) {
                if (isBlank(settings.getRegion())) {
                    errors.add("httpSdk.region is required when baseUrl contains {region}");
                } else {
                    checkUrl(baseUrl.replace("{region}", settings.getRegion()), "httpSdk.baseUrl", errors);
                }
            } else {
                checkUrl(baseUrl, "httpSdk.baseUrl", errors);
            }
            builder.baseUrl(baseUrl);
        }
        if (authType == HttpSdkConfig.AuthType.OAUTH) {
            if (isBlank(settings.getTokenUrl())) {
                errors.add("httpSdk.tokenUrl is required for oauth");
            } else {
                checkUrl(settings.getTokenUrl(), "httpSdk.tokenUrl", errors);
            }
        }
        builder.tokenUrl(settings.getTokenUrl());
        builder.scope(settings.getScope());
        builder.modelPrefix(settings.getModelPrefix());
        if (settings.getChatPath() != null) {
            checkPath(settings.getChatPath(), "httpSdk.chatPath", errors);
            builder.chatPath(settings.getChatPath());
        }
        if (settings.getHealthPath() != null) {
            if (!settings.getHealthPath().isBlank()) {
                checkPath(settings.getHealthPath(), "httpSdk.healthPath", errors);
            }
            builder.healthPath(settings.getHealthPath());
        }
        if (settings.getApiKeyHeader() != null) {
            checkHeaderName(settings.getApiKeyHeader(), "httpSdk.apiKeyHeader", errors);
            builder.apiKeyHeader(settings.getApiKeyHeader());
        }
        if (settings.getHeaders() != null) {
            settings.getHeaders().keySet().forEach(name -> checkHeaderName(name, "httpSdk.headers", errors));
            builder.headers(settings.getHeaders());
        }
        if (settings.getTimeoutSeconds() != null) {
            checkRange(settings.getTimeoutSeconds(), 1, MAX_TIMEOUT_SECONDS, "httpSdk.timeoutSeconds", errors);
            builder.timeoutSeconds(settings.getTimeoutSeconds());
        }
        return builder.build();
    }

    private ProxyConfig proxy(ProviderDefinition.ProxySettings settings, List<String> errors) {
        if (settings == null) {
            return null;
        }
        ProxyConfig.ProxyConfigBuilder builder = ProxyConfig.builder();
        if (isBlank(settings.getProxyBaseUrl())) {
            errors.add("proxy.proxyBaseUrl is required");
        } else {
            checkUrl(settings.getProxyBaseUrl(), "proxy.proxyBaseUrl", errors);
            builder.proxyBaseUrl(settings.getProxyBaseUrl().trim());
        }
        if (settings.getApiKeyHeaderName() != null) {
            checkHeaderName(settings.getApiKeyHeaderName(), "proxy.apiKeyHeaderName", errors);
            builder.apiKeyHeaderName(settings.getApiKeyHeaderName());
        }
        builder.apiKeyPrefix(settings.getApiKeyPrefix());
        if (settings.getForwardHeaders() != null) {
            settings.getForwardHeaders().forEach(name -> checkHeaderName(name, "proxy.forwardHeaders", errors));
            builder.forwardHeaders(settings.getForwardHeaders());
        }
        if (settings.getChatPath() != null) {
            checkPath(settings.getChatPath(), "proxy.chatPath", errors);
            builder.chatPath(settings.getChatPath());
        }
        if (settings.getHealthPath() != null) {
            checkPath(settings.getHealthPath(), "proxy.healthPath", errors);
            builder.healthPath(settings.getHealthPath());
        }
        builder.transformsEnabled(settings.isTransformsEnabled());
        if (settings.getRequestOverrides() != null) {
            if (settings.getRequestOverrides().containsKey("model") || settings.getRequestOverrides().containsKey("stream")) {
                errors.add("proxy.requestOverrides must not override model or stream");
            }
            builder.requestOverrides(settings.getRequestOverrides());
        }
        if (settings.getResponseContentPointer() != null) {
            if (!settings.getResponseContentPointer().startsWith("/")) {
                errors.add("proxy.responseContentPointer must be a JSON pointer starting with /");
            }
            builder.responseContentPointer(settings.getResponseContentPointer());
        }
        if (settings.getTimeoutSeconds() != null) {
            checkRange(settings.getTimeoutSeconds(), 1, MAX_TIMEOUT_SECONDS, "proxy.timeoutSeconds", errors);
            builder.timeoutSeconds(settings.getTimeoutSeconds());
        }
        return builder.build();
    }

    private LocalConfig local(ProviderDefinition.LocalSettings settings, List<String> errors) {
        if (settings == null) {
            return null;
        }
        LocalConfig.LocalConfigBuilder builder = LocalConfig.builder();
        if (isBlank(settings.getEndpoint())) {
            errors.add("local.endpoint is required");
        } else {
            checkUrl(settings.getEndpoint(), "local.endpoint", errors);
            builder.endpoint(settings.getEndpoint().trim());
        }
        builder.protocol(parseEnum(LocalConfig.Protocol.class, settings.getProtocol(),
                LocalConfig.Protocol.OPENAI, "local.protocol", errors));
        if (settings.getMaxConcurrentRequests() != null) {
            checkRange(settings.getMaxConcurrentRequests(), 1, MAX_LOCAL_CONCURRENCY, "local.maxConcurrentRequests", errors);
            builder.maxConcurrentRequests(settings.getMaxConcurrentRequests());
        }
        if (settings.getQueueTimeoutMillis() != null) {
            if (settings.getQueueTimeoutMillis() < 0) {
                errors.add("local.queueTimeoutMillis must not be negative");
            }
            builder.queueTimeoutMillis(settings.getQueueTimeoutMillis());
        }
        if (settings.getChatPath() != null) {
            checkPath(settings.getChatPath(), "local.chatPath", errors);
            builder.chatPath(settings.getChatPath());
        }
        if (settings.getHealthPath() != null) {
            checkPath(settings.getHealthPath(), "local.healthPath", errors);
            builder.healthPath(settings.getHealthPath());
        }
        if (settings.getTimeoutSeconds() != null) {
            checkRange(settings.getTimeoutSeconds(), 1, MAX_TIMEOUT_SECONDS, "local.timeoutSeconds", errors);
            builder.timeoutSeconds(settings.getTimeoutSeconds());
        }
        return builder.build();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, E defaultValue,
                                                   String field, List<String> errors) {
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            List<String> allowed = new ArrayList<>();
            for (E constant : type.getEnumConstants()) {
                allowed.add(constant.name().toLowerCase(Locale.ROOT).replace('_', '-'));
            }
            errors.add(field + " must be one of " + allowed);
            return defaultValue;
        }
    }

    private static void checkUrl(String value, String field, List<String> errors) {
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
                errors.add(field + " must be an absolute http(s) URL");
            }
        } catch (URISyntaxException e) {
            errors.add(field + " is not a valid URL");
        }
    }

    private static void checkPath(String value, String field, List<String> errors) {
        if (!value.startsWith("/")) {
            errors.add(field + " must start with /");
        }
    }

    private static void checkHeaderName(String value, String field, List<String> errors) {
        if (value == null || !HEADER_NAME.matcher(value).matches()) {
            errors.add(field + " '" + value + "' is not a valid header name");
        }
    }

    private static void checkRange(Integer value, int min, int max, String field, List<String> errors) {
        if (value != null && (value < min || value > max)) {
            errors.add(field + " must be between " + min + " and " + max);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
