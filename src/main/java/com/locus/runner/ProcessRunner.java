package com.locus.runner;

import java.time.Duration;
import java.util.Optional;

/**
 * Drives one AI coding CLI as a subprocess.
 *
 * <p>Implementations: {@link HostProcessRunner} (runs the CLI directly) and
 * {@link SandboxedProcessRunner} (runs it inside a Docker sandbox). Both are
 * chosen by configuration in {@link RunnerFactory}.
 */
public interface ProcessRunner extends AutoCloseable {

    /**
     * Whether the CLI is installed on the host.
     */
    boolean isAvailable();

    /**
     * CLI version, or empty when it cannot be determined.
     */
    Optional<String> getVersion();

    /**
     * Spawns the CLI, feeds it the prompt on stdin and blocks until it exits.
     * Never throws for process-level failures; they are reported in the result.
     */
    RunnerResult execute(RunnerOptions options);

    /**
     * Terminates the running process: SIGTERM first, SIGKILL after a grace
     * period. Idempotent and safe to call when nothing is running.
     */
    void abort();

    /**
     * Blocks until an aborted process is gone, escalating to SIGKILL once the
     * grace period has passed.
     *
     * @param timeout how long to wait after SIGKILL
     * @return true when no process is left running
     */
    default boolean awaitTermination(Duration timeout) {
        return true;
    }

    /**
     * Releases long-lived resources such as a persistent sandbox.
     */
    @Override
    default void close() {}
}
