package com.providergateway.service;

import com.providergateway.error.Sanitizer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Structured request and health events. Every event carries
 * {@code source=gateway-core} and its name; string field values are redacted.
 */
@Slf4j
@Component
public class GatewayEventLogger {

    static final String SOURCE = "gateway-core";

    public void info(String event, String providerId, String requestId, Map<String, ?> fields) {
        emit(Level.INFO, event, providerId, requestId, fields);
    }

    public void warn(String event, String providerId, String requestId, Map<String, ?> fields) {
        emit(Level.WARN, event, providerId, requestId, fields);
    }

    public void error(String event, String providerId, String requestId, Map<String, ?> fields) {
        emit(Level.ERROR, event, providerId, requestId, fields);
    }

    private void emit(Level level, String event, String providerId, String requestId, Map<String, ?> fields) {
        LoggingEventBuilder builder = log.atLevel(level)
                .addKeyValue("source", SOURCE)
                .addKeyValue("event", event);
        if (providerId != null) {
            builder = builder.addKeyValue("providerId", providerId);
        }
        if (requestId != null) {
            builder = builder.addKeyValue("requestId", requestId);
        }
        for (Map.Entry<String, ?> field : fields.entrySet()) {
            Object value = field.getValue();
            if (value == null) {
                continue;
            }
            builder = builder.addKeyValue(field.getKey(), value instanceof String ? Sanitizer.redact((String) value) : value);
        }
        builder.log(event);
    }
}
