package com.locus.runner;

import com.locus.core.config.LocusProperties;
import com.locus.core.config.WorkerConfig;
import com.locus.core.metrics.WorkerMetrics;
import com.locus.core.model.AiProvider;
import com.locus.git.ScriptedCommandExecutor;
import com.locus.sandbox.SandboxMode;
import com.locus.sandbox.SandboxRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunnerFactoryTest {

    private final RunnerFactory factory = new RunnerFactory(new ScriptedCommandExecutor(), new LocusProperties(),
            new WorkerMetrics(new SimpleMeterRegistry()));

    private static WorkerConfig config(AiProvider provider, SandboxMode mode, String sandboxName) {
        return new WorkerConfig("agent-1", "ws-1", null, "http://localhost", "key", Path.of("/tmp/project"), null,
                provider, null, true, true, mode, sandboxName, 10);
    }

    @Test
    void noSandboxRunsOnHost() {
        var runner = factory.create(config(AiProvider.CLAUDE, SandboxMode.NONE, null), new SandboxRegistry());

        assertInstanceOf(HostProcessRunner.class, runner);
    }

    @Test
    void sandboxModesUseSandboxedRunner() {
        for (var mode : new SandboxMode[] {SandboxMode.EPHEMERAL, SandboxMode.PERSISTENT}) {
            assertInstanceOf(SandboxedProcessRunner.class,
                    factory.create(config(AiProvider.CODEX, mode, null), new SandboxRegistry()));
        }
        assertInstanceOf(SandboxedProcessRunner.class,
                factory.create(config(AiProvider.CLAUDE, SandboxMode.USER_MANAGED, "box"), new SandboxRegistry()));
    }

    @Test
    void providerSelectsCliFlavour() {
        assertInstanceOf(ClaudeCli.class, AgentCli.forProvider(AiProvider.CLAUDE));
        assertInstanceOf(CodexCli.class, AgentCli.forProvider(AiProvider.CODEX));
    }

    @Test
    void cliArgumentsNeverCarryThePrompt() {
        assertEquals(List.of("exec", "--full-auto", "--skip-git-repo-check", "--json", "--model", "o4", "-"),
                new CodexCli().arguments("o4"));
        var claude = new ClaudeCli().command(null);
        assertEquals("claude", claude.get(0));
        assertTrue(claude.containsAll(List.of("--print", "--output-format", "stream-json")));
        assertFalse(claude.contains("--model"));
    }
}
