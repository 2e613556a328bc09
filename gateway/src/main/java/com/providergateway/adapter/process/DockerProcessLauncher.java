package com.providergateway.adapter.process;

import com.providergateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs the command inside a throwaway container: no network, read-only root,
 * non-root user, memory and CPU caps, only the run's working directory mounted.
 * Killing the local {@code docker run} client does not stop the container, so
 * release also issues {@code docker kill}.
 */
@Slf4j
public class DockerProcessLauncher implements ProcessLauncher {

    /**
     * {@code docker run} exit status when the daemon failed before the command ran.
     */
    public static final int SETUP_FAILURE_EXIT = 125;

    private static final List<String> CLIENT_ENVIRONMENT = List.of(
            "PATH", "HOME", "DOCKER_HOST", "DOCKER_CONFIG", "DOCKER_CONTEXT", "DOCKER_CERT_PATH", "DOCKER_TLS_VERIFY");

    private final GatewayProperties.SandboxSettings sandbox;
    private final Duration grace;

    public DockerProcessLauncher(GatewayProperties.SandboxSettings sandbox, Duration grace) {
        this.sandbox = sandbox;
        this.grace = grace;
    }

    @Override
    public SpawnedProcess launch(ExecutionSpec spec) {
        Path workDir = WorkDirs.create(sandbox.getWorkDirRoot());
        String containerName = "gw-" + UUID.randomUUID();

        ProcessBuilder builder = new ProcessBuilder(buildCommand(spec, workDir, containerName))
                .directory(workDir.toFile())
                .redirectError(workDir.resolve(SpawnedProcess.STDERR_FILE).toFile());
        builder.environment().clear();
        builder.environment().putAll(clientEnvironment());
        // Values travel through the client's environment so they never show up in argv.
        builder.environment().putAll(spec.getEnvironment());

        try {
            Process process = builder.start();
            log.debug("Started container {} for request {}", containerName, spec.getRequestId());
            return new SpawnedProcess(process, workDir, containerName, true, false,
                    () -> killContainer(containerName), grace);
        } catch (IOException e) {
            WorkDirs.deleteQuietly(workDir);
            throw new SandboxException("Failed to start container runtime " + sandbox.getDockerBinary()
                    + ": " + e.getMessage(), e);
        }
    }

    List<String> buildCommand(ExecutionSpec spec, Path workDir, String containerName) {
        List<String> command = new ArrayList<>();
        command.add(sandbox.getDockerBinary());
        command.add("run");
        command.add("--rm");
        command.add("-i");
        command.add("--name");
        command.add(containerName);
        command.add("--network");
        command.add(sandbox.getNetwork());
        command.add("--read-only");
        command.add("--tmpfs");
        command.add("/tmp");
        command.add("--cap-drop");
        command.add("ALL");
        command.add("--security-opt");
        command.add("no-new-privileges");
        command.add("--user");
        command.add(sandbox.getUser());
        command.add("--memory");
        command.add(firstNonBlank(spec.getMemoryLimit(), sandbox.getMemoryLimit()));
        command.add("--cpus");
        command.add(firstNonBlank(spec.getCpuLimit(), sandbox.getCpuLimit()));
        command.add("-v");
        command.add(workDir.toAbsolutePath() + ":" + sandbox.getContainerWorkDir());
        command.add("-w");
        command.add(sandbox.getContainerWorkDir());
        for (String name : spec.getEnvironment().keySet()) {
            command.add("-e");
            command.add(name);
        }
        command.add(firstNonBlank(spec.getImage(), sandbox.getDefaultImage()));
        command.add(spec.getCommand());
        command.addAll(spec.getArgs());
        return command;
    }

    private Map<String, String> clientEnvironment() {
        Map<String, String> env = new LinkedHashMap<>();
        for (String name : CLIENT_ENVIRONMENT) {
            String value = System.getenv(name);
            if (value != null) {
                env.put(name, value);
            }
        }
        return env;
    }

    private void killContainer(String containerName) {
        try {
            new ProcessBuilder(sandbox.getDockerBinary(), "kill", containerName)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            log.warn("Could not kill container {}: {}", containerName, e.getMessage());
        }
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
