package com.locus.git;

import com.locus.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Opens GitHub pull requests for pushed task branches through the {@code gh} CLI.
 *
 * <p>Never throws: every failure is returned as {@link PrResult#failed(String)}
 * so the caller can still report the task as completed and ask for a manual PR.
 */
public class PrService {

    private static final Logger log = LoggerFactory.getLogger(PrService.class);

    private static final Pattern PR_NUMBER = Pattern.compile("/pull/(\\d+)");
    private static final Duration GH_TIMEOUT = Duration.ofSeconds(60);

    private final CommandExecutor executor;
    private final String remote;

    public PrService(CommandExecutor executor, String remote) {
        this.executor = executor;
        this.remote = remote;
    }

    /**
     * Creates a pull request for one task's branch.
     */
    public PrResult createPr(PrRequest request) {
        var task = request.task();
        String title = "[Locus] " + task.title();
        String body = buildBody(task, request.summary(), request.agentId());
        return open(request.workDir(), title, body, request.baseBranch(), request.branch());
    }

    /**
     * Creates one pull request covering several tasks completed on the same branch.
     */
    public PrResult createRunPr(List<Task> tasks, String branch, String baseBranch, String agentId, Path workDir) {
        String title = tasks.size() == 1
                ? "[Locus] " + tasks.get(0).title()
                : "[Locus] %d tasks by agent %s".formatted(tasks.size(), shortAgentId(agentId));
        return open(workDir, title, buildRunBody(tasks, agentId), baseBranch, branch);
    }

    private PrResult open(Path workDir, String title, String body, String base, String head) {
        try {
            String precondition = checkPreconditions(workDir, base, head);
            if (precondition != null) {
                log.warn("Skipping PR for {}: {}", head, precondition);
                return PrResult.failed(precondition);
            }

            var result = executor.run(workDir, GH_TIMEOUT, List.of(
                    "gh", "pr", "create",
                    "--title", title,
                    "--body", body,
                    "--base", base,
                    "--head", head));
            if (!result.ok()) {
                String error = "gh pr create failed: " + CommandExecutor.maskSensitiveData(result.errorText());
                log.warn(error);
                return PrResult.failed(error);
            }

            String url = lastLine(result.out());
            Integer number = parsePrNumber(url);
            log.info("Created PR #{} for {}: {}", number, head, url);
            return PrResult.created(url, number);
        } catch (CommandException e) {
            log.warn("PR creation for {} failed: {}", head, e.getMessage());
            return PrResult.failed(e.getMessage());
        }
    }

    /**
     * @return a reason PR creation cannot proceed, or null when it can
     */
    String checkPreconditions(Path workDir, String base, String head) {
        var url = executor.git(workDir, "remote", "get-url", remote);
        if (!url.ok() || !url.out().contains("github.com")) {
            return "Remote '%s' is not a GitHub repository".formatted(remote);
        }
        if (!executor.isAvailable("gh")) {
            return "GitHub CLI (gh) is not installed";
        }
        if (!remoteBranchExists(workDir, base)) {
            return "Base branch '%s' does not exist on %s".formatted(base, remote);
        }
        if (!remoteBranchExists(workDir, head)) {
            return "Branch '%s' was not found on %s".formatted(head, remote);
        }
        executor.git(workDir, "fetch", remote, base, head);
        var ahead = executor.git(workDir, "rev-list", "--count",
                "%s/%s..%s/%s".formatted(remote, base, remote, head));
        if (ahead.ok() && "0".equals(ahead.out())) {
            return "Branch '%s' has no commits ahead of '%s'".formatted(head, base);
        }
        return null;
    }

    private boolean remoteBranchExists(Path workDir, String branch) {
        return executor.git(workDir, "ls-remote", "--exit-code", "--heads", remote, branch).ok();
    }

    static String buildBody(Task task, String summary, String agentId) {
        var body = new StringBuilder();
        body.append("## Task: ").append(task.title()).append("\n\n");
        if (task.description() != null && !task.description().isBlank()) {
            body.append(task.description().trim()).append("\n\n");
        }
        if (!task.acceptanceChecklist().isEmpty()) {
            body.append("## Acceptance Criteria\n\n");
            for (var item : task.acceptanceChecklist()) {
                body.append("- [ ] ").append(item).append("\n");
            }
            body.append("\n");
        }
        if (summary != null && !summary.isBlank()) {
            body.append("## Agent Summary\n\n").append(summary.trim()).append("\n\n");
        }
        body.append("---\n\n");
        body.append("*Created by Locus Agent `%s`* | Task ID: `%s`".formatted(shortAgentId(agentId), task.id()));
        return body.toString();
    }

    static String buildRunBody(List<Task> tasks, String agentId) {
        var body = new StringBuilder("## Completed Tasks\n\n");
        for (var task : tasks) {
            body.append("- **").append(task.title()).append("** (`").append(task.id()).append("`)\n");
        }
        body.append("\n---\n\n");
        body.append("*Created by Locus Agent `%s`*".formatted(shortAgentId(agentId)));
        return body.toString();
    }

    static Integer parsePrNumber(String url) {
        if (url == null) return null;
        Matcher matcher = PR_NUMBER.matcher(url);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    private static String shortAgentId(String agentId) {
        return agentId.length() > 8 ? agentId.substring(agentId.length() - 8) : agentId;
    }

    private static String lastLine(String output) {
        var lines = output.strip().split("\n");
        return lines[lines.length - 1].trim();
    }
}
