package com.locus.agent;

import com.locus.core.metrics.WorkerMetrics;
import com.locus.core.model.Task;
import com.locus.git.CommandException;
import com.locus.git.CommandExecutor;
import com.locus.git.CommitTrailers;
import com.locus.git.GitHubIdentity;
import com.locus.git.PrRequest;
import com.locus.git.PrResult;
import com.locus.git.PrService;
import com.locus.git.WorktreeManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * The git side of task execution: commit with trailers, push, open pull requests.
 *
 * <p>Failures never escape: they are folded into {@link CommitPushResult} and
 * {@link PrResult} so the worker can still report the task.
 */
public class GitWorkflow {

    private static final Logger log = LoggerFactory.getLogger(GitWorkflow.class);

    private final CommandExecutor executor;
    private final WorktreeManager worktrees;
    private final PrService prService;
    private final GitHubIdentity identity;
    private final String agentId;
    private final boolean autoPush;
    private final String branchPrefix;
    private final String botName;
    private final String botEmail;
    private final WorkerMetrics metrics;

    public GitWorkflow(CommandExecutor executor, WorktreeManager worktrees, PrService prService,
                       GitHubIdentity identity, String agentId, boolean autoPush,
                       String branchPrefix, String botName, String botEmail, WorkerMetrics metrics) {
        this.executor = executor;
        this.worktrees = worktrees;
        this.prService = prService;
        this.identity = identity;
        this.agentId = agentId;
        this.autoPush = autoPush;
        this.branchPrefix = branchPrefix;
        this.botName = botName;
        this.botEmail = botEmail;
        this.metrics = metrics;
    }

    public boolean autoPush() {
        return autoPush;
    }

    // ═══════════════════════════════════════════════════════════════════
    // PER-TASK
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Commits everything in a task worktree and pushes its branch when auto-push is on.
     */
    public CommitPushResult commitAndPush(Path worktree, Task task, String baseBranch, String baseCommitHash) {
        String hash;
        String localBranch;
        try {
            hash = worktrees.commitChanges(worktree, commitMessage(task), baseBranch, baseCommitHash);
            if (hash == null) {
                log.info("No changes to commit for task {}", task.id());
                return CommitPushResult.nothingToCommit();
            }
            localBranch = worktrees.getBranch(worktree);
        } catch (CommandException e) {
            log.error("Git commit failed for task {}: {}", task.id(), e.getMessage());
            return CommitPushResult.commitFailed("Git commit failed: " + e.getMessage());
        }

        if (!autoPush) {
            log.info("Auto-push disabled; skipping push of {}", localBranch);
            return CommitPushResult.committedOnly(localBranch);
        }
        try {
            String branch = worktrees.pushBranch(worktree);
            recordPush(true);
            return CommitPushResult.pushed(branch);
        } catch (CommandException e) {
            log.error("Git push failed for {}: {}", localBranch, e.getMessage());
            recordPush(false);
            return CommitPushResult.pushFailed(localBranch, e.getMessage());
        }
    }

    public PrResult createPullRequest(Task task, String branch, String summary, String baseBranch, Path workDir) {
        log.info("Attempting PR creation from branch {}", branch);
        return prService.createPr(new PrRequest(task, branch, baseBranch, summary, agentId, workDir));
    }

    String commitMessage(Task task) {
        return CommitTrailers.taskCommitMessage(task.title(), task.id(), agentId, botName, botEmail,
                operator());
    }

    // ═══════════════════════════════════════════════════════════════════
    // RUN BRANCH (shared checkout)
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Moves the uncommitted work of several tasks done in the shared checkout
     * onto one run branch, pushes it and opens one pull request. The checkout
     * is switched back to its original branch afterwards.
     *
     * @return the PR attempt, or empty when there was nothing to commit or the push failed
     */
    public Optional<PrResult> publishRun(Path checkout, List<Task> tasks, long timestampMillis) {
        if (tasks.isEmpty()) {
            return Optional.empty();
        }
        String runBranch = runBranchName(timestampMillis);
        String original;
        try {
            original = worktrees.getBranch(checkout);
            if (!worktrees.hasChanges(checkout)) {
                log.info("Shared checkout has no changes; no run branch created");
                return Optional.empty();
            }
            executor.gitOrThrow(checkout, "checkout", "-b", runBranch);
        } catch (CommandException e) {
            log.error("Could not create run branch {}: {}", runBranch, e.getMessage());
            return Optional.of(PrResult.failed(e.getMessage()));
        }

        try {
            String hash = worktrees.commitChanges(checkout, runCommitMessage(tasks));
            if (hash == null) {
                return Optional.empty();
            }
            worktrees.pushBranch(checkout);
            recordPush(true);
            log.info("Pushed run branch {} with {} task(s)", runBranch, tasks.size());
            return Optional.of(prService.createRunPr(tasks, runBranch, original, agentId, checkout));
        } catch (CommandException e) {
            log.error("Publishing run branch {} failed: {}", runBranch, e.getMessage());
            recordPush(false);
            return Optional.of(PrResult.failed(e.getMessage()));
        } finally {
            var back = executor.git(checkout, "checkout", original);
            if (!back.ok()) {
                log.warn("Could not switch {} back to {}: {}", checkout, original, back.errorText());
            }
        }
    }

    String runBranchName(long timestampMillis) {
        String suffix = agentId.length() > 8 ? agentId.substring(agentId.length() - 8) : agentId;
        return "%s/run-%s-%d".formatted(branchPrefix, WorktreeManager.slugify(suffix), timestampMillis);
    }

    String runCommitMessage(List<Task> tasks) {
        var message = new StringBuilder();
        if (tasks.size() == 1) {
            message.append("feat(agent): ").append(tasks.get(0).title()).append("\n\n");
        } else {
            message.append("feat(agent): complete ").append(tasks.size()).append(" tasks\n\n");
            for (var task : tasks) {
                message.append("- ").append(task.title()).append(" (").append(task.id()).append(")\n");
            }
            message.append("\n");
        }
        String taskId = tasks.size() == 1 ? tasks.get(0).id() : null;
        message.append(String.join("\n",
                CommitTrailers.trailers(taskId, agentId, botName, botEmail, operator())));
        return message.toString();
    }

    private Optional<String> operator() {
        return autoPush ? identity.username() : Optional.empty();
    }

    private void recordPush(boolean pushed) {
        if (metrics != null) {
            metrics.recordPushResult(pushed);
        }
    }
}
