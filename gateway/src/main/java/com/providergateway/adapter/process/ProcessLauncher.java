package com.providergateway.adapter.process;

/**
 * Starts a process for one request.
 *
 * @throws SandboxException if the working directory, isolation boundary or the
 *                          process itself cannot be set up
 */
public interface ProcessLauncher {

    SpawnedProcess launch(ExecutionSpec spec);
}
