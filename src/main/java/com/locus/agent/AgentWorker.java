package com.locus.agent;

import com.locus.api.ApiException;
import com.locus.api.WorkspaceApi;
import com.locus.core.config.WorkerConfig;
import com.locus.core.logging.MdcContext;
import com.locus.core.metrics.WorkerMetrics;
import com.locus.core.model.AgentState;
import com.locus.core.model.Task;
import com.locus.core.model.TaskComment;
import com.locus.core.model.TaskPatch;
import com.locus.core.model.TaskResult;
import com.locus.core.model.TaskStatus;
import com.locus.core.retry.RetryExhaustedException;
import com.locus.core.retry.RetryPolicy;
import com.locus.git.CommandException;
import com.locus.git.CreatedWorktree;
import com.locus.git.PrResult;
import com.locus.git.WorktreeCleanupPolicy;
import com.locus.git.WorktreeManager;
import com.locus.runner.ProcessRunner;
import com.locus.sandbox.SandboxRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Drains the workspace backlog: dispatch → isolate → execute → integrate → report,
 * one task at a time, with heartbeats running alongside.
 *
 * <p>{@link #shutdown()} may be called from another thread (the JVM shutdown
 * hook); it aborts the agent process and releases the task's worktree and any
 * sandboxes.
 */
public class AgentWorker {

    private static final Logger log = LoggerFactory.getLogger(AgentWorker.class);
    private static final Duration PROCESS_KILL_WAIT = Duration.ofSeconds(5);

    static final String NO_CHANGES_COMMENT =
            "⚠️ Agent execution finished with no file changes, so no commit/branch/PR was created.";

    private final WorkerConfig config;
    private final WorkspaceApi api;
    private final ProcessRunner runner;
    private final WorktreeManager worktrees;
    private final WorktreeCleanupPolicy cleanupPolicy;
    private final GitWorkflow git;
    private final TaskExecutor executor;
    private final HeartbeatScheduler heartbeat;
    private final SandboxRegistry sandboxes;
    private final WorkerMetrics metrics;
    private final RetryPolicy dispatchRetry;
    private final Duration postCleanupDelay;
    private final RetryPolicy.Sleeper sleeper;
    private final LongSupplier clock;

    private volatile WorkerState state = WorkerState.IDLE;
    private volatile Path activeWorktree;

    private int completed;
    private int blocked;
    private int failed;
    private final List<String> prUrls = new ArrayList<>();
    private final List<Task> sharedCheckoutTasks = new ArrayList<>();

    public AgentWorker(WorkerConfig config, WorkspaceApi api, ProcessRunner runner, WorktreeManager worktrees,
                       WorktreeCleanupPolicy cleanupPolicy, GitWorkflow git, TaskExecutor executor,
                       HeartbeatScheduler heartbeat, SandboxRegistry sandboxes, WorkerMetrics metrics,
                       RetryPolicy dispatchRetry, Duration postCleanupDelay,
                       RetryPolicy.Sleeper sleeper, LongSupplier clock) {
        this.config = config;
        this.api = api;
        this.runner = runner;
        this.worktrees = worktrees;
        this.cleanupPolicy = cleanupPolicy;
        this.git = git;
        this.executor = executor;
        this.heartbeat = heartbeat;
        this.sandboxes = sandboxes;
        this.metrics = metrics;
        this.dispatchRetry = dispatchRetry;
        this.postCleanupDelay = postCleanupDelay;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Dispatch retry policy: fixed delay, every error retried except a
     * definitive client error from the server.
     */
    public static RetryPolicy dispatchRetryPolicy(int maxAttempts, Duration delay, RetryPolicy.Sleeper sleeper,
                                                  WorkerMetrics metrics) {
        return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .fixedDelay(delay)
                .retryOn(e -> !(e instanceof ApiException apiError && apiError.isClientError()))
                .sleeper(sleeper)
                .onRetry((attempt, error, wait) -> {
                    if (metrics != null) {
                        metrics.incrementDispatchRetries();
                    }
                })
                .build();
    }

    public WorkerState state() {
        return state;
    }

    private synchronized void advance(WorkerState next) {
        if (!state.isTerminal()) {
            state = next;
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    // RUN LOOP
    // ═══════════════════════════════════════════════════════════════════

    public RunSummary run() {
        MdcContext.setWorker(config.agentId(), config.workspaceId());
        log.info("Agent started in {} (worktrees: {}, auto-push: {}, sandbox: {})", config.projectPath(),
                config.useWorktrees(), config.autoPush(), config.sandboxMode());
        try {
            heartbeat.start();
            logSprint();

            int processed = 0;
            while (processed < config.maxTasks() && !state.isTerminal()) {
                advance(WorkerState.DISPATCHING);
                Optional<Task> next = dispatchNext();
                if (next.isEmpty()) {
                    log.info("No more tasks to process");
                    break;
                }
                processTask(next.get());
                processed++;
                if (!state.isTerminal() && !delayAfterCleanup()) {
                    break;
                }
            }
            if (processed >= config.maxTasks()) {
                log.info("Reached the limit of {} task(s) for this run", config.maxTasks());
            }
            return finish();
        } finally {
            MdcContext.clear();
        }
    }

    private void logSprint() {
        try {
            api.findSprint(config.workspaceId(), config.sprintId()).ifPresentOrElse(
                    sprint -> log.info("Active sprint: {}", sprint.name()),
                    () -> log.warn("No active sprint found"));
        } catch (RuntimeException e) {
            log.warn("Could not look up sprint: {}", e.getMessage());
        }
    }

    Optional<Task> dispatchNext() {
        try {
            return dispatchRetry.execute("Dispatch",
                    () -> api.dispatchNextTask(config.workspaceId(), config.agentId(), config.sprintId()));
        } catch (RetryExhaustedException e) {
            log.warn("Nothing dispatched after {} attempt(s): {}", e.getAttempts(),
                    e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return Optional.empty();
        } catch (ApiException e) {
            log.warn("Dispatch rejected ({}): {}", e.getStatusCode(), e.getMessage());
            return Optional.empty();
        }
    }

    void processTask(Task claimed) {
        MdcContext.setTask(claimed.id());
        advance(WorkerState.CLAIMED);
        log.info("Claimed: {}", claimed.title());
        heartbeat.setCurrentTask(claimed.id());
        try {
            Task task = loadDetail(claimed);
            TaskResult result = executeTask(task);
            if (state == WorkerState.SHUTDOWN) {
                return;
            }
            advance(WorkerState.REPORTING);
            report(task, result);
        } finally {
            heartbeat.setCurrentTask(null);
            MdcContext.clearTask();
        }
    }

    private Task loadDetail(Task claimed) {
        try {
            return api.getTaskDetail(claimed.id(), config.workspaceId());
        } catch (RuntimeException e) {
            log.warn("Could not load details of task {}, using dispatched copy: {}", claimed.id(), e.getMessage());
            return claimed;
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    // ISOLATE, EXECUTE, INTEGRATE
    // ═══════════════════════════════════════════════════════════════════

    private TaskResult executeTask(Task task) {
        advance(WorkerState.ISOLATING);
        CreatedWorktree worktree = isolate(task);
        Path cwd = worktree != null ? worktree.path() : config.projectPath();
        activeWorktree = worktree != null ? worktree.path() : null;

        boolean keepBranch = false;
        boolean preserve = false;
        try {
            advance(WorkerState.EXECUTING);
            long started = clock.getAsLong();
            TaskResult result = executor.execute(task, runner, cwd);
            if (metrics != null) {
                metrics.recordTaskExecution(config.provider().id(), clock.getAsLong() - started);
            }
            if (!result.success() || state == WorkerState.SHUTDOWN) {
                return result;
            }

            advance(WorkerState.INTEGRATING);
            if (worktree == null) {
                sharedCheckoutTasks.add(task);
                return result;
            }

            var commit = git.commitAndPush(worktree.path(), task, worktree.baseBranch(), worktree.baseCommitHash());
            if (commit.failedToCommit()) {
                preserve = true;
                log.warn("Preserving worktree after commit failure: {}", worktree.path());
                return TaskResult.failure("%s\n\nUncommitted changes were kept in `%s`."
                        .formatted(commit.skipReason(), worktree.path()));
            }
            keepBranch = commit.committed();
            String prUrl = null;
            String prError = null;
            if (commit.pushFailed()) {
                preserve = true;
                prError = commit.pushError() != null ? commit.pushError()
                        : "Git push failed before PR creation. Please retry manually.";
                log.warn("Preserving worktree after push failure: {}", worktree.path());
            } else if (commit.pushed()) {
                PrResult pr = git.createPullRequest(task, commit.branch(), result.summary(),
                        worktree.baseBranch(), worktree.path());
                prUrl = pr.url();
                prError = pr.error();
                if (!pr.isCreated()) {
                    preserve = true;
                    log.warn("Preserving worktree for manual follow-up: {}", worktree.path());
                }
            } else if (commit.skipReason() != null) {
                log.info("Skipping PR creation: {}", commit.skipReason());
            }
            return result.withIntegration(commit.branch(), prUrl, prError, commit.noChanges());
        } finally {
            if (worktree != null && state != WorkerState.SHUTDOWN) {
                if (preserve) {
                    log.info("Worktree kept at {}", worktree.path());
                } else {
                    cleanupWorktree(worktree.path(), keepBranch);
                }
                activeWorktree = null;
            }
        }
    }

    /**
     * Creates the task worktree, or returns null to work in the shared checkout.
     */
    private CreatedWorktree isolate(Task task) {
        if (!config.useWorktrees()) {
            return null;
        }
        try {
            var created = worktrees.create(task.id(), WorktreeManager.slugify(task.title()), config.agentId(), null);
            log.info("Worktree created: {} ({})", created.path(), created.branch());
            return created;
        } catch (CommandException e) {
            log.warn("Worktree isolation unavailable, falling back to the shared checkout: {}", e.getMessage());
            return null;
        }
    }

    private void cleanupWorktree(Path path, boolean keepBranch) {
        try {
            worktrees.remove(path, !keepBranch);
            log.info(keepBranch ? "Worktree cleaned up (branch preserved)" : "Worktree cleaned up");
        } catch (CommandException e) {
            log.warn("Could not clean up worktree {}: {}", path, e.getMessage());
        }
    }

    private boolean delayAfterCleanup() {
        if (!config.useWorktrees() || postCleanupDelay.isZero() || postCleanupDelay.isNegative()) {
            return true;
        }
        log.info("Waiting {}s after worktree cleanup before next dispatch", postCleanupDelay.toSeconds());
        try {
            sleeper.sleep(postCleanupDelay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the next dispatch");
            return false;
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    // REPORTING
    // ═══════════════════════════════════════════════════════════════════

    private void report(Task task, TaskResult result) {
        try {
            if (!result.success()) {
                log.error("Failed: {} - {}", task.title(), result.summary());
                failed++;
                recordOutcome("failed");
                api.updateTaskStatus(task.id(), config.workspaceId(), TaskPatch.unassigned(TaskStatus.BACKLOG));
                comment(task, "❌ " + result.summary());
                return;
            }

            switch (IntegrationOutcome.of(result)) {
                case NO_CHANGES -> {
                    log.warn("Blocked: {} - execution produced no file changes", task.title());
                    blocked++;
                    recordOutcome("blocked");
                    api.updateTaskStatus(task.id(), config.workspaceId(), TaskPatch.unassigned(TaskStatus.BLOCKED));
                    comment(task, NO_CHANGES_COMMENT + "\n\n" + result.summary());
                }
                case COMPLETED_WITH_PR, COMPLETED_NO_PR -> {
                    log.info("Completed: {}", task.title());
                    completed++;
                    recordOutcome("in_review");
                    if (result.prUrl() != null) {
                        prUrls.add(result.prUrl());
                    }
                    api.updateTaskStatus(task.id(), config.workspaceId(), TaskPatch.inReview(result.prUrl()));
                    comment(task, completionComment(result));
                }
            }
        } catch (RuntimeException e) {
            log.error("Could not report result of task {}: {}", task.id(), e.getMessage());
        }
    }

    static String completionComment(TaskResult result) {
        var text = new StringBuilder("✅ ").append(result.summary());
        if (result.branch() != null) {
            text.append("\n\nBranch: `").append(result.branch()).append('`');
        }
        if (result.prUrl() != null) {
            text.append("\nPR: ").append(result.prUrl());
        }
        if (result.prError() != null) {
            text.append("\nPR automation error: ").append(result.prError());
        }
        return text.toString();
    }

    private void comment(Task task, String text) {
        api.addTaskComment(task.id(), config.workspaceId(), TaskComment.of(config.agentId(), text));
    }

    private void recordOutcome(String outcome) {
        if (metrics != null) {
            metrics.recordTaskOutcome(outcome);
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    // FINALIZE AND SHUTDOWN
    // ═══════════════════════════════════════════════════════════════════

    private RunSummary finish() {
        if (state == WorkerState.SHUTDOWN) {
            return summary();
        }
        advance(WorkerState.FINALIZING);
        publishSharedCheckoutWork();

        if (config.useWorktrees()) {
            try {
                worktrees.cleanup(cleanupPolicy);
            } catch (CommandException e) {
                log.warn("Worktree cleanup ({}) failed: {}", cleanupPolicy, e.getMessage());
            }
        }

        heartbeat.stop();
        heartbeat.sendFinal(AgentState.COMPLETED);
        runner.close();
        advance(WorkerState.FINISHED);

        var summary = summary();
        log.info("Run finished: {} completed, {} blocked, {} failed", summary.completed(), summary.blocked(),
                summary.failed());
        return summary;
    }

    private void publishSharedCheckoutWork() {
        if (sharedCheckoutTasks.isEmpty()) {
            return;
        }
        if (!git.autoPush()) {
            log.info("{} task(s) completed in the shared checkout; auto-push is disabled, changes left uncommitted",
                    sharedCheckoutTasks.size());
            return;
        }
        git.publishRun(config.projectPath(), List.copyOf(sharedCheckoutTasks), clock.getAsLong())
                .ifPresent(pr -> {
                    if (!pr.isCreated()) {
                        log.warn("Run PR was not created: {}", pr.error());
                        return;
                    }
                    prUrls.add(pr.url());
                    for (var task : sharedCheckoutTasks) {
                        try {
                            api.updateTaskStatus(task.id(), config.workspaceId(), TaskPatch.prUrl(pr.url()));
                        } catch (RuntimeException e) {
                            log.warn("Could not attach run PR to task {}: {}", task.id(), e.getMessage());
                        }
                    }
                });
    }

    private RunSummary summary() {
        return new RunSummary(completed, blocked, failed, prUrls);
    }

    /**
     * Forced stop: aborts the agent process and waits for it to exit, stops
     * heartbeats, removes the active worktree with its branch and destroys
     * registered sandboxes.
     *
     * @return false when the worker had already finished or shut down
     */
    public boolean shutdown() {
        synchronized (this) {
            if (state.isTerminal()) {
                return false;
            }
            state = WorkerState.SHUTDOWN;
        }
        log.warn("Received shutdown signal. Aborting...");
        runner.abort();
        if (!runner.awaitTermination(PROCESS_KILL_WAIT)) {
            log.error("Agent process is still running after SIGKILL");
        }
        heartbeat.stop();
        Path worktree = activeWorktree;
        if (worktree != null) {
            try {
                worktrees.remove(worktree, true);
            } catch (CommandException e) {
                log.warn("Could not remove worktree {} during shutdown: {}", worktree, e.getMessage());
            }
            activeWorktree = null;
        }
        sandboxes.cleanupAll();
        return true;
    }
}
