package com.locus.runner;

import com.locus.core.config.LocusProperties;
import com.locus.core.config.WorkerConfig;
import com.locus.core.metrics.WorkerMetrics;
import com.locus.git.CommandExecutor;
import com.locus.sandbox.DockerSandboxProvider;
import com.locus.sandbox.SandboxIgnorePolicy;
import com.locus.sandbox.SandboxLifecycleFactory;
import com.locus.sandbox.SandboxMode;
import com.locus.sandbox.SandboxRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Chooses the runner strategy and CLI flavour from the worker configuration.
 */
public class RunnerFactory {

    private static final Logger log = LoggerFactory.getLogger(RunnerFactory.class);

    private final CommandExecutor executor;
    private final LocusProperties properties;
    private final WorkerMetrics metrics;

    public RunnerFactory(CommandExecutor executor, LocusProperties properties, WorkerMetrics metrics) {
        this.executor = executor;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * @param registry registry that sandboxes created by the runner register with
     */
    public ProcessRunner create(WorkerConfig config, SandboxRegistry registry) {
        var cli = AgentCli.forProvider(config.provider());
        var host = new HostProcessRunner(cli, executor);
        if (config.sandboxMode() == SandboxMode.NONE) {
            log.info("Using {} directly on the host", cli.name());
            return host;
        }

        var sandboxProps = properties.getSandbox();
        var provider = new DockerSandboxProvider(executor, sandboxProps.getAgent());
        var ignorePolicy = new SandboxIgnorePolicy(sandboxProps.getIgnoreFile(), sandboxProps.getIgnoreTimeout());
        var sandboxes = new SandboxLifecycleFactory(provider, registry, ignorePolicy, metrics, config.projectPath());
        log.info("Using {} in a {} sandbox", cli.name(), config.sandboxMode().name().toLowerCase(Locale.ROOT));
        return new SandboxedProcessRunner(cli, host, sandboxes, config.sandboxMode(), config.sandboxName(),
                sandboxProps.getInstallTimeout(), sandboxProps.getAgent());
    }
}
