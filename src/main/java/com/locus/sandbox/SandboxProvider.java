package com.locus.sandbox;

import com.locus.git.CommandResult;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Abstraction over the sandbox runtime.
 * Implementation: {@link DockerSandboxProvider} ({@code docker sandbox} CLI).
 */
public interface SandboxProvider {

    /**
     * One listing row per existing sandbox; each row contains the sandbox name
     * as a whitespace-separated column.
     */
    List<String> list();

    default boolean isAlive(String name) {
        return list().stream()
                .anyMatch(row -> Arrays.asList(row.trim().split("\\s+")).contains(name));
    }

    /**
     * Creates a sandbox syncing {@code workspace} and waits until it exists.
     *
     * @throws SandboxException when the sandbox does not come up
     */
    void create(String name, Path workspace);

    /**
     * Command line that creates a sandbox and runs its built-in agent with
     * {@code agentArgs} in one step.
     */
    List<String> runCommand(String name, Path workspace, List<String> agentArgs);

    /**
     * Command line that runs {@code command} inside an existing sandbox with
     * stdin attached, in {@code workDir}.
     */
    List<String> execCommand(String name, Path workDir, List<String> command);

    /**
     * Runs a short command inside an existing sandbox and captures its output.
     */
    CommandResult exec(String name, Duration timeout, List<String> command);

    void remove(String name);
}
