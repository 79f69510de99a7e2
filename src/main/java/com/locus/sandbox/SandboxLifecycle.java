package com.locus.sandbox;

import com.locus.core.metrics.WorkerMetrics;
import com.locus.git.CommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One named sandbox and its state machine.
 *
 * <p>The name is fixed for the lifetime of the object. Owned sandboxes
 * (ephemeral, persistent) move {@code UNRESERVED → CREATED → DESTROYED} and go
 * back to {@code UNRESERVED} when the container disappears, so the next use
 * recreates it. A user-managed sandbox is treated as already created and is
 * never created or removed by the worker.
 */
public class SandboxLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SandboxLifecycle.class);

    private final String name;
    private final SandboxMode mode;
    private final Path workspace;
    private final SandboxProvider provider;
    private final SandboxRegistry registry;
    private final SandboxIgnorePolicy ignorePolicy;
    private final WorkerMetrics metrics;
    private final Set<String> installedTools = new HashSet<>();

    private SandboxState state;

    public SandboxLifecycle(String name, SandboxMode mode, Path workspace, SandboxProvider provider,
                            SandboxRegistry registry, SandboxIgnorePolicy ignorePolicy, WorkerMetrics metrics) {
        if (mode == SandboxMode.NONE) {
            throw new IllegalArgumentException("Sandbox mode NONE has no lifecycle");
        }
        this.name = name;
        this.mode = mode;
        this.workspace = workspace;
        this.provider = provider;
        this.registry = registry;
        this.ignorePolicy = ignorePolicy;
        this.metrics = metrics;
        this.state = mode == SandboxMode.USER_MANAGED ? SandboxState.CREATED : SandboxState.UNRESERVED;
    }

    public String name() {
        return name;
    }

    public SandboxMode mode() {
        return mode;
    }

    public Path workspace() {
        return workspace;
    }

    public synchronized SandboxState state() {
        return state;
    }

    public synchronized boolean needsCreation() {
        return state == SandboxState.UNRESERVED;
    }

    // ═══════════════════════════════════════════════════════════════════
    // CREATION
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Creates the container and waits until it is listed.
     */
    public synchronized void create() {
        requireOwned("create");
        if (state == SandboxState.CREATED) {
            return;
        }
        transition(SandboxState.CREATED);
        registry.register(this);
        try {
            provider.create(name, workspace);
        } catch (RuntimeException e) {
            state = SandboxState.UNRESERVED;
            registry.unregister(this);
            throw e;
        }
        recordCreated();
    }

    /**
     * Reserves the sandbox for a spawn that creates it and runs the built-in
     * agent in one step. The caller must call {@link #confirmCreated()} once
     * the spawned process has exited.
     *
     * @return the command line to spawn
     */
    public synchronized List<String> createAndRunCommand(List<String> agentArgs) {
        requireOwned("create");
        transition(SandboxState.CREATED);
        registry.register(this);
        recordCreated();
        return provider.runCommand(name, workspace, agentArgs);
    }

    /**
     * Checks that a sandbox reserved by {@link #createAndRunCommand} really came up.
     *
     * @return false when it did not, in which case the state is reset for recreation
     */
    public synchronized boolean confirmCreated() {
        if (state != SandboxState.CREATED) {
            return false;
        }
        if (provider.isAlive(name)) {
            return true;
        }
        log.warn("Sandbox {} was not found after its first run", name);
        markLost();
        return false;
    }

    // ═══════════════════════════════════════════════════════════════════
    // USE
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Verifies the container is still listed.
     *
     * @throws SandboxException when it is not; an owned sandbox is reset so the next use recreates it
     */
    public synchronized void checkAlive() {
        if (state != SandboxState.CREATED) {
            throw new SandboxException("Sandbox %s is %s".formatted(name, state.name().toLowerCase(Locale.ROOT)));
        }
        if (provider.isAlive(name)) {
            return;
        }
        if (mode.ownsLifecycle()) {
            markLost();
        }
        throw new SandboxException("Sandbox is not running: " + name);
    }

    /**
     * Command line that runs {@code command} inside the sandbox in {@code cwd}.
     * Applies the ignore policy first.
     */
    public synchronized List<String> execCommand(Path cwd, List<String> command) {
        checkAlive();
        ignorePolicy.enforce(provider, name, cwd);
        return provider.execCommand(name, cwd, command);
    }

    /**
     * Runs a short helper command inside the sandbox and captures its output.
     */
    public CommandResult exec(Duration timeout, List<String> command) {
        return provider.exec(name, timeout, command);
    }

    public synchronized boolean isToolInstalled(String binary) {
        return installedTools.contains(binary);
    }

    public synchronized void markToolInstalled(String binary) {
        installedTools.add(binary);
    }

    // ═══════════════════════════════════════════════════════════════════
    // TEARDOWN
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Ends one execution's use of the sandbox. Only ephemeral sandboxes are destroyed.
     */
    public void release() {
        if (mode == SandboxMode.EPHEMERAL) {
            destroy();
        }
    }

    /**
     * Removes an owned container and unregisters the sandbox. For a
     * user-managed sandbox the container is left alone.
     */
    public synchronized void destroy() {
        try {
            if (state == SandboxState.DESTROYED) {
                return;
            }
            if (mode.ownsLifecycle() && state == SandboxState.CREATED) {
                provider.remove(name);
            }
            transition(SandboxState.DESTROYED);
        } finally {
            registry.unregister(this);
        }
    }

    private void markLost() {
        transition(SandboxState.UNRESERVED);
        installedTools.clear();
        registry.unregister(this);
    }

    private void transition(SandboxState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Sandbox %s cannot move from %s to %s".formatted(name, state, next));
        }
        state = next;
    }

    private void requireOwned(String operation) {
        if (!mode.ownsLifecycle()) {
            throw new IllegalStateException("Cannot %s user-managed sandbox %s".formatted(operation, name));
        }
    }

    private void recordCreated() {
        if (metrics != null) {
            metrics.recordSandboxCreated(mode.name().toLowerCase(Locale.ROOT));
        }
    }
}
