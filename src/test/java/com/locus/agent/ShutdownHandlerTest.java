package com.locus.agent;

import com.locus.api.FakeWorkspaceApi;
import com.locus.core.config.WorkerConfig;
import com.locus.core.metrics.WorkerMetrics;
import com.locus.core.model.AiProvider;
import com.locus.core.model.Task;
import com.locus.git.ScriptedCommandExecutor;
import com.locus.git.WorktreeCleanupPolicy;
import com.locus.git.WorktreeManager;
import com.locus.runner.HostProcessRunner;
import com.locus.runner.RunnerListener;
import com.locus.runner.ScriptCli;
import com.locus.sandbox.SandboxMode;
import com.locus.sandbox.SandboxRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ShutdownHandlerTest {

    private final List<Integer> exits = new ArrayList<>();

    @Test
    void shutsDownWorkerAndExitsWithOne() {
        var worker = mock(AgentWorker.class);
        when(worker.shutdown()).thenReturn(true);

        new ShutdownHandler(worker, exits::add).run();

        verify(worker).shutdown();
        assertEquals(List.of(1), exits);
    }

    @Test
    void runsAtMostOnce() {
        var worker = mock(AgentWorker.class);
        when(worker.shutdown()).thenReturn(true);
        var handler = new ShutdownHandler(worker, exits::add);

        handler.run();
        handler.run();

        verify(worker, times(1)).shutdown();
        assertEquals(List.of(1), exits);
    }

    @Test
    void finishedWorkerDoesNotExit() {
        var worker = mock(AgentWorker.class);
        when(worker.shutdown()).thenReturn(false);

        new ShutdownHandler(worker, exits::add).run();

        assertTrue(exits.isEmpty());
    }

    @Test
    void registerAndUnregisterAreRepeatable() {
        var handler = new ShutdownHandler(mock(AgentWorker.class), exits::add);

        handler.register();
        handler.register();
        handler.unregister();
        handler.unregister();

        assertTrue(exits.isEmpty());
    }

    // --- real agent process ---

    @Test
    void agentIgnoringSigtermIsKilledBeforeExit(@TempDir Path project) throws Exception {
        var runner = new HostProcessRunner(
                new ScriptCli("trap '' TERM; cat >/dev/null; while :; do sleep 0.1; done"),
                new ScriptedCommandExecutor(), Duration.ofMillis(200));
        var config = new WorkerConfig("agent-1", "ws-1", null, "http://api", "key", project, null,
                AiProvider.CLAUDE, null, false, false, SandboxMode.NONE, null, 1);
        var metrics = new WorkerMetrics(new SimpleMeterRegistry());
        var worker = new AgentWorker(config, new FakeWorkspaceApi().enqueue(Task.of("t1", "Spin", "Loop forever")),
                runner, mock(WorktreeManager.class), WorktreeCleanupPolicy.MANUAL, mock(GitWorkflow.class),
                new TaskExecutor(null, RunnerListener.NONE), mock(HeartbeatScheduler.class), new SandboxRegistry(),
                metrics, AgentWorker.dispatchRetryPolicy(1, Duration.ZERO, d -> { }, metrics),
                Duration.ZERO, d -> { }, System::currentTimeMillis);

        var run = CompletableFuture.supplyAsync(worker::run);
        long deadline = System.currentTimeMillis() + 5000;
        while (!runner.isRunning()) {
            assertTrue(System.currentTimeMillis() < deadline, "agent process did not start");
            Thread.sleep(10);
        }

        var aliveAtExit = new ArrayList<Boolean>();
        new ShutdownHandler(worker, code -> aliveAtExit.add(runner.isRunning())).run();

        assertEquals(List.of(false), aliveAtExit);
        run.get(10, TimeUnit.SECONDS);
        assertEquals(WorkerState.SHUTDOWN, worker.state());
    }
}
