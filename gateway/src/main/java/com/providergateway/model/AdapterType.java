package com.providergateway.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The closed set of adapter kinds. Adding a kind means touching every switch over it.
 */
public enum AdapterType {

    SPAWN_CLI("spawn-cli"),
    HTTP_SDK("http-sdk"),
    PROXY("proxy"),
    LOCAL("local");

    private final String wireName;

    AdapterType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static AdapterType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase().replace('_', '-');
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown adapter type: " + value));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
