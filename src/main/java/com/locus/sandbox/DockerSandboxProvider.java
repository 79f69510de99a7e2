package com.locus.sandbox;

import com.locus.git.CommandException;
import com.locus.git.CommandExecutor;
import com.locus.git.CommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Docker sandbox (micro-VM) provider.
 *
 * <p>Shells out to {@code docker sandbox}; the Docker Engine API exposed by
 * docker-java has no equivalent for sandboxes.
 */
public class DockerSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxProvider.class);

    private static final Duration LIST_TIMEOUT = Duration.ofSeconds(15);
    private static final Duration CREATE_TIMEOUT = Duration.ofMinutes(3);
    private static final Duration REMOVE_TIMEOUT = Duration.ofSeconds(60);

    private final CommandExecutor executor;
    private final String agent;

    /**
     * @param executor command runner
     * @param agent    the sandbox's built-in agent image (e.g. "claude")
     */
    public DockerSandboxProvider(CommandExecutor executor, String agent) {
        this.executor = executor;
        this.agent = agent;
    }

    @Override
    public List<String> list() {
        var result = executor.run(null, LIST_TIMEOUT, List.of("docker", "sandbox", "ls"));
        if (!result.ok()) {
            throw new SandboxException("docker sandbox ls failed: " + result.errorText());
        }
        return parseRows(result.stdout());
    }

    @Override
    public void create(String name, Path workspace) {
        log.info("Creating sandbox {} with workspace {}", name, workspace);
        var result = executor.run(null, CREATE_TIMEOUT,
                runCommand(name, workspace, List.of("--version")));
        // the agent's --version may exit non-zero; the sandbox existing is what counts
        if (!isAlive(name)) {
            throw new SandboxException("Failed to create sandbox %s: %s".formatted(name, result.errorText()));
        }
    }

    @Override
    public List<String> runCommand(String name, Path workspace, List<String> agentArgs) {
        var command = new ArrayList<>(List.of("docker", "sandbox", "run", "--name", name, agent, workspace.toString()));
        if (!agentArgs.isEmpty()) {
            command.add("--");
            command.addAll(agentArgs);
        }
        return command;
    }

    @Override
    public List<String> execCommand(String name, Path workDir, List<String> command) {
        var full = new ArrayList<>(List.of("docker", "sandbox", "exec", "-i", "-w", workDir.toString(), name));
        full.addAll(command);
        return full;
    }

    @Override
    public CommandResult exec(String name, Duration timeout, List<String> command) {
        var full = new ArrayList<>(List.of("docker", "sandbox", "exec", name));
        full.addAll(command);
        return executor.run(null, timeout, full);
    }

    @Override
    public void remove(String name) {
        try {
            var result = executor.run(null, REMOVE_TIMEOUT, List.of("docker", "sandbox", "rm", name));
            if (result.ok()) {
                log.info("Removed sandbox {}", name);
            } else {
                log.warn("Failed to remove sandbox {}: {}", name, result.errorText());
            }
        } catch (CommandException e) {
            log.warn("Failed to remove sandbox {}: {}", name, e.getMessage());
        }
    }

    /**
     * Rows of {@code docker sandbox ls} output without the header line.
     */
    static List<String> parseRows(String output) {
        var rows = new ArrayList<String>();
        if (output == null || output.isBlank()) {
            return rows;
        }
        var lines = output.strip().split("\n");
        for (int i = 0; i < lines.length; i++) {
            var line = lines[i].trim();
            boolean header = i == 0 && line.equals(line.toUpperCase()) && line.matches("[A-Z ]+");
            if (!line.isEmpty() && !header) {
                rows.add(line);
            }
        }
        return rows;
    }
}
