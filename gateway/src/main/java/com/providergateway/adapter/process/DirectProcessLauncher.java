package com.providergateway.adapter.process;

import com.providergateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the command on the host, in a fresh working directory and with only the
 * environment the execution spec carries. Where {@code setsid} exists the child
 * leads its own process group, and release kills the whole group, including
 * background children that outlive the command itself.
 */
@Slf4j
public class DirectProcessLauncher implements ProcessLauncher {

    private final GatewayProperties.SandboxSettings sandbox;
    private static final List<String> SETSID_LOCATIONS = List.of("/usr/bin/setsid", "/bin/setsid");

    private final Duration grace;
    private final Optional<Path> setsid;
    private final String searchPath;

    public DirectProcessLauncher(GatewayProperties.SandboxSettings sandbox, Duration grace) {
        this(sandbox, grace, findSetsid(), System.getenv("PATH"));
    }

    DirectProcessLauncher(GatewayProperties.SandboxSettings sandbox, Duration grace,
                          Optional<Path> setsid, String searchPath) {
        this.sandbox = sandbox;
        this.grace = grace;
        this.setsid = setsid;
        this.searchPath = searchPath;
    }

    @Override
    public SpawnedProcess launch(ExecutionSpec spec) {
        Path executable = resolve(spec.getCommand());
        Path workDir = WorkDirs.create(sandbox.getWorkDirRoot());

        List<String> command = new ArrayList<>();
        setsid.ifPresent(path -> command.add(path.toString()));
        command.add(executable.toString());
        command.addAll(spec.getArgs());

        ProcessBuilder builder = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectError(workDir.resolve(SpawnedProcess.STDERR_FILE).toFile());
        builder.environment().clear();
        builder.environment().putAll(spec.getEnvironment());

        try {
            Process process = builder.start();
            log.debug("Started {} (pid {}) for request {}", spec.getCommand(), process.pid(), spec.getRequestId());
            return new SpawnedProcess(process, workDir, spec.getCommand() + "#" + process.pid(), false,
                    setsid.isPresent(), null, grace);
        } catch (IOException e) {
            WorkDirs.deleteQuietly(workDir);
            throw new SandboxException("Failed to start " + spec.getCommand() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Looks the command up on the gateway's own PATH. The child environment is
     * cleared, so {@code setsid} could not find it there.
     */
    Path resolve(String command) {
        if (command.contains(File.separator)) {
            Path path = Paths.get(command);
            if (Files.isExecutable(path)) {
                return path;
            }
            throw new SandboxException("Command " + command + " is not an executable file");
        }
        if (searchPath != null) {
            for (String dir : searchPath.split(File.pathSeparator)) {
                if (dir.isEmpty()) {
                    continue;
                }
                Path candidate = Paths.get(dir, command);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return candidate;
                }
            }
        }
        throw new SandboxException("Command " + command + " not found on PATH");
    }

    private static Optional<Path> findSetsid() {
        return SETSID_LOCATIONS.stream()
                .map(Paths::get)
                .filter(Files::isExecutable)
                .findFirst();
    }
}
