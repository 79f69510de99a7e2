package com.locus.dispatch.cli;

import com.locus.agent.AgentWorkerFactory;
import com.locus.agent.ShutdownHandler;
import com.locus.core.config.LocusProperties;
import com.locus.core.config.WorkerConfig;
import com.locus.core.model.AiProvider;
import com.locus.runner.RunnerListener;
import com.locus.sandbox.SandboxMode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: locus run --agent-id ... --workspace-id ...
 * <p>
 * Starts a worker that claims backlog tasks one at a time until the backlog
 * is empty or the task limit is reached.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Drain the workspace backlog with an AI agent")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = "--agent-id", description = "Agent identity reported to the server")
    String agentId;

    @Option(names = "--workspace-id", description = "Workspace whose backlog is processed")
    String workspaceId;

    @Option(names = "--sprint-id", description = "Only dispatch tasks of this sprint")
    String sprintId;

    @Option(names = "--api-url", defaultValue = "${env:LOCUS_API_URL}", description = "Workspace API base URL (env: LOCUS_API_URL)")
    String apiUrl;

    @Option(names = "--api-key", defaultValue = "${env:LOCUS_API_KEY}", description = "API key (env: LOCUS_API_KEY)")
    String apiKey;

    @Option(names = "--project-path", description = "Git checkout the agent works in")
    Path projectPath;

    @Option(names = "--main-project-path", description = "Main checkout when --project-path is a worktree")
    Path mainProjectPath;

    @Option(names = "--model", description = "Model override passed to the AI CLI")
    String model;

    @Option(names = "--provider", defaultValue = "claude", description = "AI CLI: claude, codex (default: ${DEFAULT-VALUE})")
    String provider;

    @Option(names = "--use-worktrees", description = "Isolate each task in its own git worktree (default)")
    boolean useWorktrees;

    @Option(names = "--no-worktrees", description = "Work directly in the project checkout")
    boolean noWorktrees;

    @Option(names = "--auto-push", description = "Push task branches and open pull requests")
    boolean autoPush;

    @Option(names = "--sandbox", defaultValue = "none",
            description = "Sandbox mode: none, ephemeral, persistent, user-managed (default: ${DEFAULT-VALUE})")
    String sandbox;

    @Option(names = "--sandbox-name", description = "Existing sandbox to use with --sandbox user-managed")
    String sandboxName;

    @Option(names = "--max-tasks", description = "Maximum number of tasks to process")
    Integer maxTasks;

    private final AgentWorkerFactory workerFactory;
    private final LocusProperties properties;

    public RunCommand(AgentWorkerFactory workerFactory, LocusProperties properties) {
        this.workerFactory = workerFactory;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (useWorktrees && noWorktrees) {
            ConsoleOutput.error("--use-worktrees and --no-worktrees cannot be combined");
            return 1;
        }
        SandboxMode sandboxMode;
        try {
            sandboxMode = SandboxMode.parse(sandbox);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid sandbox mode: " + sandbox
                    + ". Valid modes: none, ephemeral, persistent, user-managed");
            return 1;
        }

        var config = toConfig(sandboxMode);
        var missing = config.missingRequired();
        if (!missing.isEmpty()) {
            ConsoleOutput.error("Missing required arguments: " + String.join(", ", missing));
            return 1;
        }

        ConsoleOutput.info("Agent %s on workspace %s (%s, sandbox: %s)".formatted(
                config.agentId(), config.workspaceId(), config.provider().id(),
                sandboxMode.name().toLowerCase(Locale.ROOT)));

        var worker = workerFactory.create(config, new ConsoleListener());
        var shutdown = new ShutdownHandler(worker);
        shutdown.register();
        try {
            var summary = worker.run();
            ConsoleOutput.summary(summary);
            return 0;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Fatal worker error: " + e.getMessage());
            return 1;
        } finally {
            shutdown.unregister();
        }
    }

    WorkerConfig toConfig(SandboxMode sandboxMode) {
        int limit = maxTasks != null ? maxTasks : properties.getWorker().getMaxTasks();
        return new WorkerConfig(agentId, workspaceId, sprintId, apiUrl, apiKey,
                projectPath, mainProjectPath, AiProvider.parse(provider), model,
                !noWorktrees, autoPush, sandboxMode, sandboxName, limit);
    }

    static final class ConsoleListener implements RunnerListener {
        @Override
        public void onOutput(String text) {
            if (!text.isBlank()) {
                ConsoleOutput.agentOutput(text);
            }
        }

        @Override
        public void onToolActivity(String activity) {
            ConsoleOutput.tool(activity);
        }

        @Override
        public void onThinking(String text) {
            if (!text.isBlank()) {
                ConsoleOutput.thinking(text);
            }
        }
    }
}
