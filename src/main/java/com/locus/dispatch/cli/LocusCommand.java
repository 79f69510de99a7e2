package com.locus.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for the Locus worker.
 * Routes to subcommands: run, worktree, sandbox.
 */
@Command(
        name = "locus",
        mixinStandardHelpOptions = true,
        version = "Locus Worker 0.1.0",
        description = "Autonomous worker that drains a Locus backlog with an AI coding agent",
        subcommands = {
                RunCommand.class,
                WorktreeCommand.class,
                SandboxCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LocusCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
