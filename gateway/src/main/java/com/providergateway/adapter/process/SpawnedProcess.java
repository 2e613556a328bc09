package com.providergateway.adapter.process;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A running child process with its private working directory. {@link #destroyTree}
 * is idempotent and is the single release path: it kills the process group (when
 * the child leads one) and descendants before the process itself, runs any
 * runtime-level kill, and removes the working directory once the process has exited.
 */
@Slf4j
public class SpawnedProcess implements AutoCloseable {

    static final String STDERR_FILE = ".stderr";

    private final Process process;
    private final Path workDir;
    private final String label;
    private final boolean sandboxed;
    private final boolean groupLeader;
    private final Runnable runtimeKill;
    private final Duration grace;
    private final AtomicBoolean released = new AtomicBoolean();

    SpawnedProcess(Process process, Path workDir, String label, boolean sandboxed, boolean groupLeader,
                   Runnable runtimeKill, Duration grace) {
        this.process = process;
        this.workDir = workDir;
        this.label = label;
        this.sandboxed = sandboxed;
        this.groupLeader = groupLeader;
        this.runtimeKill = runtimeKill;
        this.grace = grace;
    }

    public OutputStream stdin() {
        return process.getOutputStream();
    }

    public InputStream stdout() {
        return process.getInputStream();
    }

    public ProcessHandle handle() {
        return process.toHandle();
    }

    public String getLabel() {
        return label;
    }

    public boolean isSandboxed() {
        return sandboxed;
    }

    /**
     * True once {@link #destroyTree()} ran; reads failing after this are expected.
     */
    public boolean isReleased() {
        return released.get();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public int waitFor(Duration timeout) throws InterruptedException {
        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return -1;
        }
        return process.exitValue();
    }

    /**
     * Tail of what the process wrote to stderr. Only meant for operator logs.
     */
    public String readStderr(int maxChars) {
        Path file = workDir.resolve(STDERR_FILE);
        try {
            if (!Files.exists(file)) {
                return "";
            }
            String content = Files.readString(file, StandardCharsets.UTF_8).trim();
            return content.length() <= maxChars ? content : content.substring(content.length() - maxChars);
        } catch (IOException e) {
            log.debug("Could not read stderr of {}: {}", label, e.getMessage());
            return "";
        }
    }

    public void destroyTree() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        // Background children keep the group alive after the command itself has exited.
        if (groupLeader) {
            killGroup();
        }
        if (process.isAlive()) {
            // Snapshot first: children are reparented once the parent dies.
            List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
            descendants.forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            if (runtimeKill != null) {
                runtimeKill.run();
            }
            log.debug("Killed process tree of {} ({} descendants)", label, descendants.size());
        }
        closeQuietly();
        process.onExit()
                .orTimeout(grace.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((exited, error) -> {
                    if (error != null) {
                        log.warn("Process {} still alive {} ms after kill", label, grace.toMillis());
                    }
                    deleteWorkDir();
                });
    }

    @Override
    public void close() {
        destroyTree();
    }

    private void killGroup() {
        try {
            Process kill = new ProcessBuilder("kill", "-KILL", "--", "-" + process.pid())
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            if (!kill.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                kill.destroyForcibly();
                log.warn("Group kill of {} did not finish within {} ms", label, grace.toMillis());
            }
        } catch (IOException e) {
            log.warn("Could not kill process group of {}: {}", label, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while killing process group of {}", label);
        }
    }

    private void closeQuietly() {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.trace("stdin of {} already closed", label);
        }
    }

    private void deleteWorkDir() {
        try (Stream<Path> paths = Files.walk(workDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.debug("Could not clean working directory {}: {}", workDir, e.getMessage());
        }
    }
}
