package com.providergateway.config;

import com.providergateway.error.ErrorKind;
import com.providergateway.error.GatewayException;
import com.providergateway.error.Sanitizer;
import com.providergateway.model.ChatModels;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(GatewayException.class)
    public Mono<ResponseEntity<ChatModels.ErrorResponse>> handleGatewayException(GatewayException ex) {
        return Mono.just(toResponse(ex, ex.getKind().getStatus()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ChatModels.ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .reduce((a, b) -> a + ", " + b)
                .orElse("Validation failed");

        log.warn("Validation error: {}", message);

        return Mono.just(ResponseEntity.badRequest()
                .body(createErrorResponse("invalid_request_error", message, "validation_error", null)));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ChatModels.ErrorResponse>> handleInputException(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());

        return Mono.just(ResponseEntity.badRequest()
                .body(createErrorResponse("invalid_request_error", "Request body could not be read", "invalid_request", null)));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ChatModels.ErrorResponse>> handleResponseStatusException(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        return Mono.just(ResponseEntity.status(status)
                .body(createErrorResponse("invalid_request_error",
                        ex.getReason() != null ? ex.getReason() : String.valueOf(status), "request_error", null)));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ChatModels.ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(createErrorResponse("server_error", "An unexpected error occurred", "internal_error", null)));
    }

    /**
     * OpenAI-style body for a classified failure. Only the public message and
     * the correlation id reach the client; the detail goes to the log.
     */
    public static ResponseEntity<ChatModels.ErrorResponse> toResponse(GatewayException ex, HttpStatusCode status) {
        ErrorKind kind = ex.getKind();
        if (status.is5xxServerError() && kind != ErrorKind.OVERLOADED && kind != ErrorKind.ALL_PROVIDERS_UNHEALTHY) {
            log.error("Request {} failed with {}: {}", ex.getRequestId(), kind.getCode(), Sanitizer.redact(ex.getMessage()));
        } else {
            log.warn("Request {} failed with {}: {}", ex.getRequestId(), kind.getCode(), Sanitizer.redact(ex.getMessage()));
        }

        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (kind.isRetryable()) {
            builder.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        }
        if (ex.getRequestId() != null) {
            builder.header("X-Request-Id", ex.getRequestId());
        }
        return builder.body(createErrorResponse(kind.getType(), ex.getPublicMessage(), kind.getCode(), ex.getRequestId()));
    }

    static ChatModels.ErrorResponse createErrorResponse(String type, String message, String code, String correlationId) {
        return ChatModels.ErrorResponse.builder()
                .error(ChatModels.ErrorResponse.Error.builder()
                        .type(type)
                        .message(message)
                        .code(code)
                        .correlationId(correlationId)
                        .build())
                .build();
    }
}
