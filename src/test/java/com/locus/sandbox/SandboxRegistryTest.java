package com.locus.sandbox;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SandboxRegistryTest {

    private final FakeSandboxProvider provider = new FakeSandboxProvider();
    private final SandboxRegistry registry = new SandboxRegistry();

    private SandboxLifecycle created(String name) {
        var box = new SandboxLifecycle(name, SandboxMode.EPHEMERAL, Path.of("/tmp"), provider, registry,
                new SandboxIgnorePolicy(".sandboxignore", Duration.ofSeconds(1)), null);
        box.create();
        return box;
    }

    @Test
    void cleanupAllDestroysEveryRegisteredSandbox() {
        created("a");
        created("b");

        registry.cleanupAll();

        assertTrue(registry.activeNames().isEmpty());
        assertEquals(Set.of("a", "b"), Set.copyOf(provider.removed()));
    }

    @Test
    void oneFailingSandboxDoesNotStopTheOthers() {
        var failing = mock(SandboxLifecycle.class);
        when(failing.name()).thenReturn("bad");
        doThrow(new SandboxException("docker gone")).when(failing).destroy();
        registry.register(failing);
        created("good");

        registry.cleanupAll();

        assertEquals(Set.of("good"), Set.copyOf(provider.removed()));
        assertEquals(Set.of("bad"), registry.activeNames());
    }

    @Test
    void unregisterIgnoresReplacedEntry() {
        var first = created("same");
        var replacement = mock(SandboxLifecycle.class);
        when(replacement.name()).thenReturn("same");
        registry.register(replacement);

        registry.unregister(first);

        assertEquals(Set.of("same"), registry.activeNames());
    }
}
