package com.locus.sandbox;

import com.locus.core.metrics.WorkerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SandboxLifecycleTest {

    @TempDir
    Path workspace;

    private FakeSandboxProvider provider;
    private SandboxRegistry registry;
    private SimpleMeterRegistry meters;
    private SandboxIgnorePolicy ignorePolicy;

    @BeforeEach
    void setUp() {
        provider = new FakeSandboxProvider();
        registry = new SandboxRegistry();
        meters = new SimpleMeterRegistry();
        ignorePolicy = new SandboxIgnorePolicy(".sandboxignore", Duration.ofSeconds(5));
    }

    private SandboxLifecycle sandbox(String name, SandboxMode mode) {
        return new SandboxLifecycle(name, mode, workspace, provider, registry, ignorePolicy, new WorkerMetrics(meters));
    }

    @Test
    void noneModeHasNoLifecycle() {
        assertThrows(IllegalArgumentException.class, () -> sandbox("x", SandboxMode.NONE));
    }

    // --- owned sandboxes ---

    @Test
    void createRegistersAndRecordsMetric() {
        var box = sandbox("box-1", SandboxMode.PERSISTENT);
        assertTrue(box.needsCreation());

        box.create();
        box.create();

        assertEquals(SandboxState.CREATED, box.state());
        assertEquals(List.of("box-1"), provider.created());
        assertEquals(Set.of("box-1"), registry.activeNames());
        assertEquals(1.0, meters.get("locus.sandbox.created").tag("mode", "persistent").counter().count());
    }

    @Test
    void failedCreateReturnsToUnreserved() {
        provider.failCreate();
        var box = sandbox("box-1", SandboxMode.EPHEMERAL);

        assertThrows(SandboxException.class, box::create);

        assertEquals(SandboxState.UNRESERVED, box.state());
        assertTrue(registry.activeNames().isEmpty());
    }

    @Test
    void createAndRunReservesSandboxUntilConfirmed() {
        var box = sandbox("box-1", SandboxMode.PERSISTENT);

        var command = box.createAndRunCommand(List.of("--print"));

        assertEquals("sh", command.get(0));
        assertEquals(SandboxState.CREATED, box.state());
        assertTrue(box.confirmCreated());
    }

    @Test
    void unconfirmedSandboxIsResetForRecreation() {
        var box = sandbox("box-1", SandboxMode.PERSISTENT);
        box.createAndRunCommand(List.of());
        provider.kill("box-1");

        assertFalse(box.confirmCreated());
        assertTrue(box.needsCreation());
        assertTrue(registry.activeNames().isEmpty());
    }

    @Test
    void lostSandboxForgetsInstalledTools() {
        var box = sandbox("box-1", SandboxMode.PERSISTENT);
        box.create();
        box.markToolInstalled("codex");
        provider.kill("box-1");

        var e = assertThrows(SandboxException.class, box::checkAlive);

        assertEquals("Sandbox is not running: box-1", e.getMessage());
        assertTrue(box.needsCreation());
        assertFalse(box.isToolInstalled("codex"));
    }

    @Test
    void execBeforeCreateFails() {
        var box = sandbox("box-1", SandboxMode.EPHEMERAL);

        var e = assertThrows(SandboxException.class, () -> box.execCommand(workspace, List.of("codex")));
        assertEquals("Sandbox box-1 is unreserved", e.getMessage());
    }

    @Test
    void releaseDestroysOnlyEphemeralSandboxes() {
        var ephemeral = sandbox("eph", SandboxMode.EPHEMERAL);
        var persistent = sandbox("per", SandboxMode.PERSISTENT);
        ephemeral.create();
        persistent.create();

        ephemeral.release();
        persistent.release();

        assertEquals(SandboxState.DESTROYED, ephemeral.state());
        assertEquals(SandboxState.CREATED, persistent.state());
        assertEquals(List.of("eph"), provider.removed());
        assertEquals(Set.of("per"), registry.activeNames());
    }

    @Test
    void destroyIsIdempotent() {
        var box = sandbox("box-1", SandboxMode.PERSISTENT);
        box.create();

        box.destroy();
        box.destroy();

        assertEquals(List.of("box-1"), provider.removed());
        assertThrows(IllegalStateException.class, box::create);
    }

    @Test
    void destroyingUnusedSandboxRemovesNothing() {
        var box = sandbox("box-1", SandboxMode.EPHEMERAL);

        box.destroy();

        assertEquals(SandboxState.DESTROYED, box.state());
        assertTrue(provider.removed().isEmpty());
    }

    // --- user-managed ---

    @Test
    void userManagedSandboxStartsCreatedAndIsNeverRemoved() {
        provider.withExisting("mine");
        var box = sandbox("mine", SandboxMode.USER_MANAGED);

        assertFalse(box.needsCreation());
        assertEquals("sh", box.execCommand(workspace, List.of("claude")).get(0));
        assertThrows(IllegalStateException.class, box::create);
        assertThrows(IllegalStateException.class, () -> box.createAndRunCommand(List.of()));

        box.destroy();

        assertTrue(provider.removed().isEmpty());
        assertTrue(provider.exists("mine"));
    }

    @Test
    void missingUserManagedSandboxStaysCreated() {
        var box = sandbox("mine", SandboxMode.USER_MANAGED);

        assertThrows(SandboxException.class, box::checkAlive);
        assertEquals(SandboxState.CREATED, box.state());
    }
}
