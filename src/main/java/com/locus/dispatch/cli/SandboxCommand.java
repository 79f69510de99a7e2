package com.locus.dispatch.cli;

import com.locus.core.config.LocusProperties;
import com.locus.git.CommandException;
import com.locus.git.CommandExecutor;
import com.locus.sandbox.DockerSandboxProvider;
import com.locus.sandbox.SandboxException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * CLI command: locus sandbox status|rm &lt;name&gt;
 */
@Command(name = "sandbox", mixinStandardHelpOptions = true, description = "Check or remove Docker sandboxes")
@Component
public class SandboxCommand implements Runnable {

    @Spec
    CommandSpec spec;

    private final CommandExecutor executor;
    private final LocusProperties properties;

    public SandboxCommand(CommandExecutor executor, LocusProperties properties) {
        this.executor = executor;
        this.properties = properties;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "status", description = "Report whether a sandbox is running")
    int status(@Parameters(paramLabel = "NAME", description = "Sandbox name") String name) {
        try {
            if (provider().isAlive(name)) {
                ConsoleOutput.sandbox(name + " is running");
                return 0;
            }
            ConsoleOutput.sandbox(name + " is not running");
            return 1;
        } catch (SandboxException | CommandException e) {
            ConsoleOutput.error("Could not query sandboxes: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "rm", description = "Remove a sandbox")
    int remove(@Parameters(paramLabel = "NAME", description = "Sandbox name") String name) {
        try {
            var provider = provider();
            if (!provider.isAlive(name)) {
                ConsoleOutput.error("No sandbox named " + name);
                return 1;
            }
            provider.remove(name);
            ConsoleOutput.success("Removed sandbox " + name);
            return 0;
        } catch (SandboxException | CommandException e) {
            ConsoleOutput.error("Could not remove sandbox: " + e.getMessage());
            return 1;
        }
    }

    private DockerSandboxProvider provider() {
        return new DockerSandboxProvider(executor, properties.getSandbox().getAgent());
    }
}
