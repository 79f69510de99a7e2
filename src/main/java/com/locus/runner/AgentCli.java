package com.locus.runner;

import com.locus.core.model.AiProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Flavour-specific details of an AI coding CLI: how to invoke it and how to
 * read its output.
 */
public interface AgentCli {

    /** Name used in log and error messages. */
    String name();

    /** Executable name. */
    String binary();

    /** Arguments after the binary. The prompt is never passed as an argument. */
    List<String> arguments(String model);

    StreamParser newParser(RunnerListener listener);

    /** Strips the CLI's name from its {@code --version} output. */
    String parseVersion(String versionOutput);

    /** Environment variables removed from the child process. */
    default Set<String> removedEnvironment() {
        return Set.of();
    }

    /** npm package to install when the sandbox image lacks this CLI. */
    default Optional<String> sandboxPackage() {
        return Optional.empty();
    }

    default List<String> command(String model) {
        var command = new ArrayList<String>();
        command.add(binary());
        command.addAll(arguments(model));
        return command;
    }

    static AgentCli forProvider(AiProvider provider) {
        return switch (provider) {
            case CLAUDE -> new ClaudeCli();
            case CODEX -> new CodexCli();
        };
    }
}
