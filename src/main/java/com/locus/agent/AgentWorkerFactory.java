package com.locus.agent;

import com.locus.api.HttpWorkspaceApi;
import com.locus.api.WorkspaceApi;
import com.locus.core.config.LocusProperties;
import com.locus.core.config.WorkerConfig;
import com.locus.core.metrics.WorkerMetrics;
import com.locus.core.retry.RetryPolicy;
import com.locus.git.CommandExecutor;
import com.locus.git.GitHubIdentity;
import com.locus.git.PrService;
import com.locus.git.WorktreeCleanupPolicy;
import com.locus.git.WorktreeManager;
import com.locus.runner.RunnerFactory;
import com.locus.runner.RunnerListener;
import com.locus.sandbox.SandboxRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Assembles an {@link AgentWorker} and its collaborators for one run.
 */
@Component
public class AgentWorkerFactory {

    private static final Logger log = LoggerFactory.getLogger(AgentWorkerFactory.class);

    private final LocusProperties properties;
    private final CommandExecutor executor;
    private final WorkerMetrics metrics;

    public AgentWorkerFactory(LocusProperties properties, CommandExecutor executor, WorkerMetrics metrics) {
        this.properties = properties;
        this.executor = executor;
        this.metrics = metrics;
    }

    public AgentWorker create(WorkerConfig config, RunnerListener listener) {
        var api = new HttpWorkspaceApi(config.apiBase(), config.apiKey(),
                properties.getApi().getConnectTimeout(), properties.getApi().getRequestTimeout());
        return create(config, api, listener);
    }

    AgentWorker create(WorkerConfig config, WorkspaceApi api, RunnerListener listener) {
        var gitProps = properties.getGit();
        var workerProps = properties.getWorker();

        boolean useWorktrees = config.useWorktrees();
        if (useWorktrees && !executor.isAvailable("git")) {
            log.error("git is not installed; worktree isolation disabled");
            useWorktrees = false;
        }
        if (config.autoPush() && !executor.isAvailable("gh")) {
            log.warn("GitHub CLI (gh) not available. Branches can still be pushed, but PR creation will fail "
                    + "until gh is installed and authenticated: https://cli.github.com/");
        }
        var effective = useWorktrees == config.useWorktrees() ? config : config.withUseWorktrees(false);

        var worktrees = new WorktreeManager(executor, effective.repositoryPath(), gitProps.getRemote(),
                gitProps.getBranchPrefix(), gitProps.getBaseBranch(), gitProps.getWorktreeRoot());
        var git = new GitWorkflow(executor, worktrees, new PrService(executor, gitProps.getRemote()),
                new GitHubIdentity(executor), effective.agentId(), effective.autoPush(),
                gitProps.getBranchPrefix(), gitProps.getBotName(), gitProps.getBotEmail(), metrics);

        var sandboxes = new SandboxRegistry();
        var runner = new RunnerFactory(executor, properties, metrics).create(effective, sandboxes);
        var heartbeat = new HeartbeatScheduler(api, effective.workspaceId(), effective.agentId(),
                workerProps.getHeartbeatInterval(), metrics);

        RetryPolicy.Sleeper sleeper = AgentWorkerFactory::sleep;
        return new AgentWorker(effective, api, runner, worktrees,
                WorktreeCleanupPolicy.parse(gitProps.getCleanupPolicy()), git,
                new TaskExecutor(effective.model(), listener), heartbeat, sandboxes, metrics,
                AgentWorker.dispatchRetryPolicy(workerProps.getDispatchMaxAttempts(),
                        workerProps.getDispatchDelay(), sleeper, metrics),
                workerProps.getPostCleanupDelay(), sleeper, System::currentTimeMillis);
    }

    private static void sleep(Duration duration) throws InterruptedException {
        Thread.sleep(duration.toMillis());
    }
}
