package com.providergateway.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class SpawnCliConfig implements AdapterConfig {

    public enum InputChannel { STDIN, ARGUMENT }

    public enum InputFormat { JSON, TEXT }

    public enum OutputFormat { TEXT, JSON_LINES }

    String command;

    /**
     * Arguments passed before any argument-encoded payload. {@code {model}} is
     * replaced with the native model id.
     */
    @Singular
    List<String> args;

    @Builder.Default
    InputChannel inputChannel = InputChannel.STDIN;

    @Builder.Default
    InputFormat inputFormat = InputFormat.JSON;

    @Builder.Default
    OutputFormat outputFormat = OutputFormat.TEXT;

    @Builder.Default
    boolean sandboxed = true;

    String sandboxImage;
    String memoryLimit;
    String cpuLimit;

    /**
     * Variables set in the child environment. Nothing else is inherited unless
     * listed in {@link #inheritEnvironment}.
     */
    @Singular("environmentVariable")
    Map<String, String> environment;

    @Singular("inheritVariable")
    List<String> inheritEnvironment;

    @Builder.Default
    int timeoutSeconds = 60;

    @Builder.Default
    long maxOutputBytes = 1_048_576;

    @Override
    public AdapterType type() {
        return AdapterType.SPAWN_CLI;
    }
}
