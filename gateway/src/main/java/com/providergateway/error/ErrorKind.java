package com.providergateway.error;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

/**
 * Classification of every failure the gateway core can report.
 * Each kind carries its client-facing status, OpenAI-style error type and code,
 * and whether the caller may retry.
 */
public enum ErrorKind {

    NOT_FOUND(HttpStatus.NOT_FOUND, "invalid_request_error", "model_not_found",
            "No provider is configured for the requested model", false),
    ALL_PROVIDERS_UNHEALTHY(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable", "all_providers_unhealthy",
            "All providers for the requested model are currently unhealthy", false),
    TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "internal_error", "adapter_timeout",
            "The provider did not respond before the deadline", true),
    OVERLOADED(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable", "provider_overloaded",
            "The provider is at capacity, retry later", true),
    SANDBOX_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "sandbox_failure",
            "The provider execution environment could not be prepared", false),
    UPSTREAM_ERROR(HttpStatus.BAD_GATEWAY, "provider_error", "upstream_error",
            "The provider returned an error", false),
    MALFORMED_UPSTREAM_RESPONSE(HttpStatus.BAD_GATEWAY, "provider_error", "malformed_upstream_response",
            "The provider returned a response that could not be interpreted", false),
    CONFIGURATION_INVALID(HttpStatus.INTERNAL_SERVER_ERROR, "invalid_configuration", "configuration_invalid",
            "The provider configuration is invalid", false),
    CANCELLED(HttpStatusCode.valueOf(499), "request_cancelled", "cancelled",
            "The request was cancelled", false);

    private final HttpStatusCode status;
    private final String type;
    private final String code;
    private final String publicMessage;
    private final boolean retryable;

    ErrorKind(HttpStatusCode status, String type, String code, String publicMessage, boolean retryable) {
        this.status = status;
        this.type = type;
        this.code = code;
        this.publicMessage = publicMessage;
        this.retryable = retryable;
    }

    public HttpStatusCode getStatus() {
        return status;
    }

    public String getType() {
        return type;
    }

    public String getCode() {
        return code;
    }

    public String getPublicMessage() {
        return publicMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Whether a failure of this kind says something about the provider itself,
     * as opposed to local backpressure or the client going away.
     */
    public boolean countsAgainstProvider() {
        return this == TIMEOUT
                || this == SANDBOX_FAILURE
                || this == UPSTREAM_ERROR
                || this == MALFORMED_UPSTREAM_RESPONSE;
    }
}
