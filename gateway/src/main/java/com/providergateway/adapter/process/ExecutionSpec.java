package com.providergateway.adapter.process;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What to run. The environment is the complete child environment; launchers add
 * nothing from the gateway's own.
 */
@Value
@Builder
public class ExecutionSpec {
    String requestId;
    String command;

    @Singular
    List<String> args;

    @Singular("environmentVariable")
    Map<String, String> environment;

    String image;
    String memoryLimit;
    String cpuLimit;
}
