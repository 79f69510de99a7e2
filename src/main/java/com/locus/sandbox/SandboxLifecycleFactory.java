package com.locus.sandbox;

import com.locus.core.metrics.WorkerMetrics;

import java.nio.file.Path;
import java.util.function.LongSupplier;

/**
 * Builds {@link SandboxLifecycle} objects sharing one provider, registry and ignore policy.
 */
public class SandboxLifecycleFactory {

    private final SandboxProvider provider;
    private final SandboxRegistry registry;
    private final SandboxIgnorePolicy ignorePolicy;
    private final WorkerMetrics metrics;
    private final Path projectPath;
    private final LongSupplier clock;

    public SandboxLifecycleFactory(SandboxProvider provider, SandboxRegistry registry,
                                   SandboxIgnorePolicy ignorePolicy, WorkerMetrics metrics, Path projectPath) {
        this(provider, registry, ignorePolicy, metrics, projectPath, System::currentTimeMillis);
    }

    SandboxLifecycleFactory(SandboxProvider provider, SandboxRegistry registry, SandboxIgnorePolicy ignorePolicy,
                            WorkerMetrics metrics, Path projectPath, LongSupplier clock) {
        this.provider = provider;
        this.registry = registry;
        this.ignorePolicy = ignorePolicy;
        this.metrics = metrics;
        this.projectPath = projectPath;
        this.clock = clock;
    }

    /**
     * A sandbox for a single execution, syncing {@code workspace}.
     */
    public SandboxLifecycle ephemeral(Path workspace, String activity) {
        return new SandboxLifecycle(SandboxNames.generate(projectPath, activity, clock.getAsLong()),
                SandboxMode.EPHEMERAL, workspace, provider, registry, ignorePolicy, metrics);
    }

    /**
     * A sandbox syncing the whole project, reused until destroyed.
     */
    public SandboxLifecycle persistent() {
        return new SandboxLifecycle(SandboxNames.generate(projectPath, null, clock.getAsLong()),
                SandboxMode.PERSISTENT, projectPath, provider, registry, ignorePolicy, metrics);
    }

    public SandboxLifecycle userManaged(String name) {
        return new SandboxLifecycle(name, SandboxMode.USER_MANAGED, projectPath,
                provider, registry, ignorePolicy, metrics);
    }

    public SandboxProvider provider() {
        return provider;
    }
}
