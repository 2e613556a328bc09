package com.providergateway.adapter.process;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Slf4j
final class WorkDirs {

    private static final String PREFIX = "gw-run-";

    private WorkDirs() {
    }

    static Path create(String root) {
        try {
            if (root == null || root.isBlank()) {
                return Files.createTempDirectory(PREFIX);
            }
            Path parent = Paths.get(root);
            Files.createDirectories(parent);
            return Files.createTempDirectory(parent, PREFIX);
        } catch (IOException e) {
            throw new SandboxException("Could not create working directory: " + e.getMessage(), e);
        }
    }

    static void deleteQuietly(Path dir) {
        try {
            Files.deleteIfExists(dir.resolve(SpawnedProcess.STDERR_FILE));
            Files.deleteIfExists(dir);
        } catch (IOException e) {
            log.debug("Could not remove {}: {}", dir, e.getMessage());
        }
    }
}
