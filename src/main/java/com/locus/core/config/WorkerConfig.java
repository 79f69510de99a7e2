package com.locus.core.config;

import com.locus.core.model.AiProvider;
import com.locus.sandbox.SandboxMode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable per-process worker configuration, built once from CLI flags.
 *
 * @param agentId         identity reported to the workspace server
 * @param workspaceId     workspace whose backlog is drained
 * @param sprintId        optional sprint scope for dispatch
 * @param apiBase         base URL of the workspace API
 * @param apiKey          API key sent as a bearer token
 * @param projectPath     git checkout the agent works in
 * @param mainProjectPath main checkout when {@code projectPath} is itself a worktree, may be null
 * @param provider        AI CLI flavour
 * @param model           model override, may be null
 * @param useWorktrees    isolate each task in its own git worktree
 * @param autoPush        push branches and open pull requests
 * @param sandboxMode     sandbox lifecycle for the AI CLI
 * @param sandboxName     sandbox to use when {@code sandboxMode} is user-managed
 * @param maxTasks        maximum number of tasks processed per run
 */
public record WorkerConfig(
    String agentId,
    String workspaceId,
    String sprintId,
    String apiBase,
    String apiKey,
    Path projectPath,
    Path mainProjectPath,
    AiProvider provider,
    String model,
    boolean useWorktrees,
    boolean autoPush,
    SandboxMode sandboxMode,
    String sandboxName,
    int maxTasks
) {

    public WorkerConfig {
        provider = provider == null ? AiProvider.CLAUDE : provider;
        sandboxMode = sandboxMode == null ? SandboxMode.NONE : sandboxMode;
        sprintId = blankToNull(sprintId);
        model = blankToNull(model);
        sandboxName = blankToNull(sandboxName);
    }

    /**
     * Names of required settings that are missing, in flag order.
     */
    public List<String> missingRequired() {
        var missing = new ArrayList<String>();
        if (isBlank(agentId)) missing.add("--agent-id");
        if (isBlank(workspaceId)) missing.add("--workspace-id");
        if (isBlank(apiBase)) missing.add("--api-url");
        if (isBlank(apiKey)) missing.add("--api-key");
        if (projectPath == null) missing.add("--project-path");
        if (sandboxMode == SandboxMode.USER_MANAGED && sandboxName == null) missing.add("--sandbox-name");
        return missing;
    }

    /**
     * The checkout git commands should run against. Worktrees are always
     * created from the main checkout.
     */
    public Path repositoryPath() {
        return mainProjectPath != null ? mainProjectPath : projectPath;
    }

    public WorkerConfig withUseWorktrees(boolean enabled) {
        return new WorkerConfig(agentId, workspaceId, sprintId, apiBase, apiKey, projectPath, mainProjectPath,
                provider, model, enabled, autoPush, sandboxMode, sandboxName, maxTasks);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }
}
