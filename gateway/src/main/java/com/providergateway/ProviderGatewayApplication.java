package com.providergateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ProviderGatewayApplication {
    public static void main(String[] args) {
        SpringApplication.run(ProviderGatewayApplication.class, args);
    }
}
