package com.locus.runner;

import com.locus.core.logging.MdcContext;
import com.locus.git.CommandException;
import com.locus.sandbox.SandboxException;
import com.locus.sandbox.SandboxLifecycle;
import com.locus.sandbox.SandboxLifecycleFactory;
import com.locus.sandbox.SandboxMode;
import com.locus.sandbox.SandboxState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Runs the agent CLI inside a Docker sandbox.
 *
 * <p>Availability and version describe the host tool; the sandboxed copy is
 * provisioned lazily. When the CLI is the sandbox's built-in agent and runs in
 * the sandbox workspace, a new sandbox is created and the agent started by a
 * single {@code docker sandbox run}. Otherwise the sandbox is created first and
 * the CLI is exec'd into it, installing it through npm when the image lacks it.
 */
public class SandboxedProcessRunner extends AbstractProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(SandboxedProcessRunner.class);

    private static final Duration WHICH_TIMEOUT = Duration.ofSeconds(15);

    private final ProcessRunner host;
    private final SandboxLifecycleFactory sandboxes;
    private final SandboxMode mode;
    private final String userSandboxName;
    private final Duration installTimeout;
    private final boolean nativeAgent;

    private SandboxLifecycle shared;

    public SandboxedProcessRunner(AgentCli cli, ProcessRunner host, SandboxLifecycleFactory sandboxes,
                                  SandboxMode mode, String userSandboxName, Duration installTimeout,
                                  String sandboxAgent) {
        this(cli, host, sandboxes, mode, userSandboxName, installTimeout, sandboxAgent, DEFAULT_KILL_GRACE);
    }

    SandboxedProcessRunner(AgentCli cli, ProcessRunner host, SandboxLifecycleFactory sandboxes,
                           SandboxMode mode, String userSandboxName, Duration installTimeout,
                           String sandboxAgent, Duration killGrace) {
        super(cli, killGrace);
        if (mode == SandboxMode.NONE) {
            throw new IllegalArgumentException("Sandboxed runner needs a sandbox mode");
        }
        if (mode == SandboxMode.USER_MANAGED && (userSandboxName == null || userSandboxName.isBlank())) {
            throw new IllegalArgumentException("A user-managed sandbox needs a name");
        }
        this.host = host;
        this.sandboxes = sandboxes;
        this.mode = mode;
        this.userSandboxName = userSandboxName;
        this.installTimeout = installTimeout;
        this.nativeAgent = cli.binary().equals(sandboxAgent);
    }

    @Override
    public boolean isAvailable() {
        return host.isAvailable();
    }

    @Override
    public Optional<String> getVersion() {
        return host.getVersion();
    }

    @Override
    protected RunnerResult doExecute(RunnerOptions options) {
        SandboxLifecycle sandbox = acquire(options);
        MdcContext.setSandbox(sandbox.name());
        try {
            if (sandbox.needsCreation() && nativeAgent && sandbox.workspace().equals(options.cwd())) {
                var command = sandbox.createAndRunCommand(cli.arguments(options.model()));
                log.info("Starting {} in new {} sandbox {}", cli.name(), mode.name().toLowerCase(Locale.ROOT), sandbox.name());
                var result = spawn(command, options);
                sandbox.confirmCreated();
                return result;
            }

            if (sandbox.needsCreation()) {
                sandbox.create();
            }
            ensureInstalled(sandbox);
            return spawn(sandbox.execCommand(options.cwd(), cli.command(options.model())), options);
        } catch (SandboxException | CommandException e) {
            log.warn("Sandbox execution failed: {}", e.getMessage());
            return RunnerResult.failure("", e.getMessage(), 1);
        } finally {
            sandbox.release();
            MdcContext.clearSandbox();
        }
    }

    private synchronized SandboxLifecycle acquire(RunnerOptions options) {
        return switch (mode) {
            case EPHEMERAL -> sandboxes.ephemeral(options.cwd(), options.activity());
            case PERSISTENT -> {
                if (shared == null || shared.state() == SandboxState.DESTROYED) {
                    shared = sandboxes.persistent();
                }
                yield shared;
            }
            case USER_MANAGED -> {
                if (shared == null) {
                    shared = sandboxes.userManaged(userSandboxName);
                }
                yield shared;
            }
            case NONE -> throw new IllegalStateException("unreachable");
        };
    }

    /**
     * Makes sure the CLI binary exists inside the sandbox. A {@code which} hit
     * or an earlier install in the same sandbox skips the npm install.
     */
    private void ensureInstalled(SandboxLifecycle sandbox) {
        var pkg = cli.sandboxPackage();
        if (nativeAgent || pkg.isEmpty() || sandbox.isToolInstalled(cli.binary())) {
            return;
        }
        var which = sandbox.exec(WHICH_TIMEOUT, List.of("which", cli.binary()));
        if (!which.ok()) {
            log.info("Installing {} in sandbox {}", pkg.get(), sandbox.name());
            var install = sandbox.exec(installTimeout, List.of("npm", "install", "-g", pkg.get()));
            if (!install.ok()) {
                throw new SandboxException("Failed to install %s in sandbox %s: %s"
                        .formatted(pkg.get(), sandbox.name(), install.errorText()));
            }
        }
        sandbox.markToolInstalled(cli.binary());
    }

    /**
     * Destroys the persistent sandbox, if one was created.
     */
    @Override
    public synchronized void close() {
        if (shared != null && mode == SandboxMode.PERSISTENT) {
            shared.destroy();
        }
    }
}
