package com.locus.runner;

import com.locus.git.CommandException;
import com.locus.git.CommandExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Runs the agent CLI directly on the host.
 */
public class HostProcessRunner extends AbstractProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(HostProcessRunner.class);

    private final CommandExecutor executor;

    public HostProcessRunner(AgentCli cli, CommandExecutor executor) {
        this(cli, executor, DEFAULT_KILL_GRACE);
    }

    public HostProcessRunner(AgentCli cli, CommandExecutor executor, Duration killGrace) {
        super(cli, killGrace);
        this.executor = executor;
    }

    @Override
    public boolean isAvailable() {
        return executor.isAvailable(cli.binary());
    }

    @Override
    public Optional<String> getVersion() {
        try {
            var result = executor.run(null, Duration.ofSeconds(10), List.of(cli.binary(), "--version"));
            return result.ok() ? Optional.of(cli.parseVersion(result.out())) : Optional.empty();
        } catch (CommandException e) {
            log.debug("Could not determine {} version: {}", cli.name(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    protected RunnerResult doExecute(RunnerOptions options) {
        return spawn(cli.command(options.model()), options);
    }
}
