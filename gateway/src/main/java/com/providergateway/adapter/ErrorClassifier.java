package com.providergateway.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.providergateway.error.AdapterException;
import com.providergateway.error.ErrorKind;
import com.providergateway.error.GatewayException;
import com.providergateway.error.Sanitizer;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps whatever an adapter pipeline threw onto a {@link GatewayException}.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static GatewayException classify(Throwable error, String source) {
        if (error instanceof GatewayException) {
            return (GatewayException) error;
        }
        if (error instanceof TimeoutException) {
            return new AdapterException(ErrorKind.TIMEOUT, source + " timed out", error);
        }
        if (error instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) error;
            return new AdapterException(ErrorKind.UPSTREAM_ERROR, source + " returned HTTP "
                    + response.getStatusCode().value() + ": "
                    + Sanitizer.snapshot(response.getResponseBodyAsString()), error);
        }
        if (error instanceof WebClientRequestException) {
            return new AdapterException(ErrorKind.UPSTREAM_ERROR,
                    source + " unreachable: " + Sanitizer.redact(error.getMessage()), error);
        }
        if (error instanceof BulkheadFullException) {
            return new AdapterException(ErrorKind.OVERLOADED, source + " is at capacity", error);
        }
        if (error instanceof JsonProcessingException || error instanceof DecodingException) {
            return AdapterException.malformed(source + " sent an unreadable response: "
                    + Sanitizer.redact(error.getMessage()), error);
        }
        if (error instanceof CancellationException) {
            return new AdapterException(ErrorKind.CANCELLED, source + " call cancelled", error);
        }
        return new AdapterException(ErrorKind.UPSTREAM_ERROR,
                source + " failed: " + Sanitizer.redact(String.valueOf(error.getMessage())), error);
    }
}
