package com.locus.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Creates, commits, pushes and removes per-task git worktrees.
 *
 * <p>Each task gets its own working copy under
 * {@code <repo>/<worktreeRoot>/<agentId>-<taskId>} on a dedicated
 * {@code <prefix>/<slug>} branch, so one task's file changes never collide
 * with another's. All commands shell out to the {@code git} CLI through
 * {@link CommandExecutor}.
 */
public class WorktreeManager {

    private static final Logger log = LoggerFactory.getLogger(WorktreeManager.class);

    static final int TITLE_SLUG_LENGTH = 40;
    static final int BRANCH_SLUG_LENGTH = 50;

    private final CommandExecutor executor;
    private final Path repoPath;
    private final String remote;
    private final String branchPrefix;
    private final String configuredBaseBranch;
    private final Path worktreeRoot;

    public WorktreeManager(CommandExecutor executor, Path repoPath, String remote, String branchPrefix,
                           String configuredBaseBranch, String worktreeRoot) {
        this.executor = executor;
        this.repoPath = repoPath.toAbsolutePath().normalize();
        this.remote = remote;
        this.branchPrefix = branchPrefix;
        this.configuredBaseBranch = configuredBaseBranch == null || configuredBaseBranch.isBlank()
                ? null : configuredBaseBranch;
        this.worktreeRoot = this.repoPath.resolve(worktreeRoot).normalize();
    }

    /**
     * Turns a task title into a branch-safe slug: lowercase, runs of anything
     * other than {@code [a-z0-9]} collapsed to {@code -}, trimmed, at most 40 chars.
     */
    public static String slugify(String title) {
        return sanitize(title, TITLE_SLUG_LENGTH);
    }

    // ═══════════════════════════════════════════════════════════════════
    //  CREATE
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Creates an isolated worktree for one task.
     *
     * <p>A stale worktree left behind for the same task is removed first. When
     * the branch name is already taken by other work, the task id is appended
     * so existing branches are never overwritten.
     *
     * @param taskId     task identifier
     * @param slug       slug derived from the task title
     * @param agentId    worker identity, part of the directory name
     * @param baseBranch branch to start from, or null for the configured/current branch
     * @return the created worktree
     * @throws CommandException when git cannot create the worktree
     */
    public CreatedWorktree create(String taskId, String slug, String agentId, String baseBranch) {
        Path path = worktreePath(agentId, taskId);
        String base = resolveBaseBranch(baseBranch);
        ensureLocalBranch(base);

        if (Files.exists(path) || findByPath(path) != null) {
            log.info("Removing stale worktree for task {} at {}", taskId, path);
            remove(path, true);
        }

        String branch = chooseBranchName(taskId, slug);
        log.info("Creating worktree for task {} at {} (branch: {}, base: {})", taskId, path, branch, base);

        try {
            Files.createDirectories(path.getParent());
        } catch (IOException e) {
            throw new CommandException("Cannot create worktree root %s".formatted(path.getParent()), e);
        }

        var result = executor.git(repoPath, "worktree", "add", path.toString(), "-b", branch, base);
        if (!result.ok()) {
            log.warn("worktree add failed ({}), pruning and retrying once", result.errorText());
            executor.git(repoPath, "worktree", "prune");
            deleteBranchQuietly(branch);
            executor.gitOrThrow(repoPath, "worktree", "add", path.toString(), "-b", branch, base);
        }

        String baseCommit = executor.gitOrThrow(path, "rev-parse", "HEAD");
        log.info("Worktree created for task {} at {}", taskId, path);
        return new CreatedWorktree(path, branch, base, baseCommit);
    }

    Path worktreePath(String agentId, String taskId) {
        return worktreeRoot.resolve(pathSafe(agentId) + "-" + pathSafe(taskId));
    }

    private String chooseBranchName(String taskId, String slug) {
        String branchSlug = sanitize(slug, BRANCH_SLUG_LENGTH);
        String taskPart = sanitize(taskId, BRANCH_SLUG_LENGTH);
        if (branchSlug.isEmpty()) {
            branchSlug = taskPart;
        }
        String branch = branchPrefix + "/" + branchSlug;
        if (!branchExists(branch)) {
            return branch;
        }

        String suffix = taskPart.length() > 8 ? taskPart.substring(taskPart.length() - 8) : taskPart;
        String taskBranch = branch + "-" + suffix;
        if (branchExists(taskBranch)) {
            // leftover from an earlier attempt at this same task
            releaseBranch(taskBranch);
        }
        return taskBranch;
    }

    private void releaseBranch(String branch) {
        for (var info : list()) {
            if (!branch.equals(info.branch())) {
                continue;
            }
            if (info.isMain() || !isManaged(info.path())) {
                throw new CommandException("git branch -D " + branch, 1,
                        "branch is checked out in an unmanaged worktree at " + info.path());
            }
            remove(info.path(), false);
        }
        executor.gitOrThrow(repoPath, "branch", "-D", branch);
    }

    private String resolveBaseBranch(String requested) {
        if (requested != null && !requested.isBlank()) {
            return requested;
        }
        if (configuredBaseBranch != null) {
            return configuredBaseBranch;
        }
        return executor.gitOrThrow(repoPath, "rev-parse", "--abbrev-ref", "HEAD");
    }

    private void ensureLocalBranch(String branch) {
        if ("HEAD".equals(branch) || branchExists(branch)) {
            return;
        }
        log.info("Base branch '{}' not found locally, fetching from {}", branch, remote);
        executor.gitOrThrow(repoPath, "fetch", remote, branch + ":" + branch);
    }

    private boolean branchExists(String branch) {
        return executor.git(repoPath, "rev-parse", "--verify", "--quiet", "refs/heads/" + branch).ok();
    }

    // ═══════════════════════════════════════════════════════════════════
    //  COMMIT AND PUSH
    // ═══════════════════════════════════════════════════════════════════

    public boolean hasChanges(Path worktree) {
        return !executor.gitOrThrow(worktree, "status", "--porcelain").isEmpty();
    }

    public String getBranch(Path worktree) {
        return executor.gitOrThrow(worktree, "rev-parse", "--abbrev-ref", "HEAD");
    }

    public String commitChanges(Path worktree, String message) {
        return commitChanges(worktree, message, null, null);
    }

    /**
     * Stages and commits everything in the worktree.
     *
     * <p>If the agent already committed on its own, there is nothing left to
     * stage but the branch is ahead of its base; the current HEAD is returned.
     *
     * @return the commit hash, or null when there is nothing to commit
     */
    public String commitChanges(Path worktree, String message, String baseBranch, String baseCommitHash) {
        if (!hasChanges(worktree)) {
            String head = executor.gitOrThrow(worktree, "rev-parse", "HEAD");
            if (baseBranch != null) {
                var ahead = executor.git(worktree, "rev-list", "--count", baseBranch + "..HEAD");
                if (ahead.ok() && parseCount(ahead.out()) > 0) {
                    log.info("No uncommitted changes but HEAD is {} commit(s) ahead of {}", ahead.out(), baseBranch);
                    return head;
                }
            } else if (baseCommitHash != null && !baseCommitHash.equals(head)) {
                return head;
            }
            return null;
        }

        executor.gitOrThrow(worktree, "add", "-A");
        String staged = executor.gitOrThrow(worktree, "diff", "--cached", "--name-only");
        if (staged.isEmpty()) {
            return null;
        }
        executor.gitOrThrow(worktree, "commit", "-m", message);
        String hash = executor.gitOrThrow(worktree, "rev-parse", "HEAD");
        log.info("Committed {} file(s) in {} as {}", staged.lines().count(), worktree, hash);
        return hash;
    }

    /**
     * Pushes the worktree's branch to the remote. A non-fast-forward rejection
     * is retried once with {@code --force-with-lease} after fetching.
     *
     * @return the pushed branch name
     * @throws CommandException when the push fails
     */
    public String pushBranch(Path worktree) {
        String branch = getBranch(worktree);
        var result = executor.git(worktree, "push", "-u", remote, branch);
        if (result.ok()) {
            log.info("Pushed branch {} to {}", branch, remote);
            return branch;
        }

        if (isNonFastForward(result.stderr())) {
            log.warn("Push of {} rejected as non-fast-forward, retrying with --force-with-lease", branch);
            executor.git(worktree, "fetch", remote, branch);
            var retry = executor.git(worktree, "push", "--force-with-lease", "-u", remote, branch);
            if (retry.ok()) {
                log.info("Pushed branch {} to {} with --force-with-lease", branch, remote);
                return branch;
            }
            result = retry;
        }
        throw new CommandException("git push -u %s %s".formatted(remote, branch), result.exitCode(),
                CommandExecutor.maskSensitiveData(result.errorText()));
    }

    static boolean isNonFastForward(String stderr) {
        if (stderr == null) return false;
        return stderr.contains("non-fast-forward") || stderr.contains("[rejected]") || stderr.contains("fetch first");
    }

    // ═══════════════════════════════════════════════════════════════════
    //  REMOVE AND INSPECT
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Removes a worktree directory, and its branch when {@code deleteBranch} is true.
     */
    public void remove(Path worktree, boolean deleteBranch) {
        String branch = null;
        if (deleteBranch && Files.isDirectory(worktree)) {
            var head = executor.git(worktree, "rev-parse", "--abbrev-ref", "HEAD");
            branch = head.ok() ? head.out() : null;
        }
        if (deleteBranch && branch == null) {
            var info = findByPath(worktree);
            branch = info != null ? info.branch() : null;
        }

        var result = executor.git(repoPath, "worktree", "remove", "--force", worktree.toString());
        if (!result.ok()) {
            log.warn("git worktree remove failed for {} ({}), deleting directory", worktree, result.errorText());
            deleteDirectory(worktree);
            executor.git(repoPath, "worktree", "prune");
        }
        log.info("Removed worktree {}", worktree);

        if (deleteBranch && branch != null && !"HEAD".equals(branch)) {
            deleteBranchQuietly(branch);
        }
    }

    public List<WorktreeInfo> list() {
        return parsePorcelain(executor.gitOrThrow(repoPath, "worktree", "list", "--porcelain"));
    }

    /**
     * Worktrees created by this manager (under the worktree root).
     */
    public List<WorktreeInfo> listAgentWorktrees() {
        return list().stream()
                .filter(info -> !info.isMain() && isManaged(info.path()))
                .toList();
    }

    public boolean hasWorktreeForTask(String agentId, String taskId) {
        return Files.isDirectory(worktreePath(agentId, taskId));
    }

    /**
     * Drops metadata of worktrees whose directories are gone.
     *
     * @return the number of prunable entries before pruning
     */
    public int prune() {
        int prunable = (int) list().stream().filter(WorktreeInfo::prunable).count();
        executor.gitOrThrow(repoPath, "worktree", "prune");
        if (prunable > 0) {
            log.info("Pruned {} stale worktree(s)", prunable);
        }
        return prunable;
    }

    /**
     * Removes every managed worktree, keeping their branches.
     *
     * @return the number of worktrees removed
     */
    public int removeAll() {
        int removed = 0;
        for (var info : listAgentWorktrees()) {
            remove(info.path(), false);
            removed++;
        }
        executor.git(repoPath, "worktree", "prune");
        return removed;
    }

    /**
     * Applies the end-of-run cleanup policy.
     */
    public void cleanup(WorktreeCleanupPolicy policy) {
        switch (policy) {
            case AUTO -> log.info("Removed {} managed worktree(s)", removeAll());
            case RETAIN_ON_FAILURE -> prune();
            case MANUAL -> log.info("Worktree cleanup policy is manual, leaving {} untouched", worktreeRoot);
        }
    }

    static List<WorktreeInfo> parsePorcelain(String output) {
        var result = new ArrayList<WorktreeInfo>();
        if (output == null || output.isBlank()) {
            return result;
        }
        String path = null;
        String head = null;
        String branch = null;
        boolean prunable = false;
        for (var line : (output + "\n\n").split("\n", -1)) {
            if (line.isBlank()) {
                if (path != null) {
                    result.add(new WorktreeInfo(Path.of(path), head, branch, result.isEmpty(), prunable));
                }
                path = null;
                head = null;
                branch = null;
                prunable = false;
            } else if (line.startsWith("worktree ")) {
                path = line.substring("worktree ".length());
            } else if (line.startsWith("HEAD ")) {
                head = line.substring("HEAD ".length());
            } else if (line.startsWith("branch ")) {
                branch = line.substring("branch ".length()).replaceFirst("^refs/heads/", "");
            } else if (line.startsWith("prunable")) {
                prunable = true;
            }
        }
        return result;
    }

    private WorktreeInfo findByPath(Path worktree) {
        var normalized = worktree.toAbsolutePath().normalize();
        var entries = executor.git(repoPath, "worktree", "list", "--porcelain");
        if (!entries.ok()) {
            return null;
        }
        return parsePorcelain(entries.stdout()).stream()
                .filter(info -> info.path().toAbsolutePath().normalize().equals(normalized))
                .findFirst()
                .orElse(null);
    }

    private boolean isManaged(Path path) {
        return path.toAbsolutePath().normalize().startsWith(worktreeRoot);
    }

    private void deleteBranchQuietly(String branch) {
        var result = executor.git(repoPath, "branch", "-D", branch);
        if (result.ok()) {
            log.info("Deleted branch {}", branch);
        } else {
            log.debug("Could not delete branch '{}': {}", branch, result.errorText());
        }
    }

    private static void deleteDirectory(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Failed to delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to delete directory {}: {}", dir, e.getMessage());
        }
    }

    private static int parseCount(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String sanitize(String value, int maxLength) {
        if (value == null) return "";
        String slug = value.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-|-$", "");
        if (slug.length() > maxLength) {
            slug = slug.substring(0, maxLength).replaceAll("-$", "");
        }
        return slug;
    }

    private static String pathSafe(String value) {
        return value.replaceAll("[^A-Za-z0-9._-]", "-");
    }
}
