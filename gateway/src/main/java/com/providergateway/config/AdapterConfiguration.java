package com.providergateway.config;

import com.providergateway.adapter.process.DirectProcessLauncher;
import com.providergateway.adapter.process.DockerProcessLauncher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Process launchers for spawn-cli providers. The bulkhead registry used by local
 * providers comes from the resilience4j starter.
 */
@Configuration
public class AdapterConfiguration {

    @Bean
    public DirectProcessLauncher directProcessLauncher(GatewayProperties properties) {
        return new DirectProcessLauncher(properties.getSandbox(),
                Duration.ofMillis(properties.getStreaming().getCancelGraceMillis()));
    }

    @Bean
    public DockerProcessLauncher dockerProcessLauncher(GatewayProperties properties) {
        return new DockerProcessLauncher(properties.getSandbox(),
                Duration.ofMillis(properties.getStreaming().getCancelGraceMillis()));
    }
}
