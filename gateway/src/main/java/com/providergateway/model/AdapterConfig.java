package com.providergateway.model;

/**
 * Validated, immutable adapter configuration. Exactly one implementation exists per
 * {@link AdapterType}: {@link SpawnCliConfig}, {@link HttpSdkConfig}, {@link ProxyConfig}
 * and {@link LocalConfig}.
 */
public interface AdapterConfig {

    AdapterType type();

    int getTimeoutSeconds();
}
