package com.locus.agent;

import com.locus.core.metrics.WorkerMetrics;
import com.locus.core.model.Task;
import com.locus.git.CommandException;
import com.locus.git.GitHubIdentity;
import com.locus.git.PrRequest;
import com.locus.git.PrResult;
import com.locus.git.PrService;
import com.locus.git.ScriptedCommandExecutor;
import com.locus.git.WorktreeManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GitWorkflowTest {

    private static final Path WORKTREE = Path.of("/work/app/.locus-worktrees/agent-1-t1");
    private static final Path CHECKOUT = Path.of("/work/app");

    private ScriptedCommandExecutor executor;
    private WorktreeManager worktrees;
    private PrService prService;
    private GitHubIdentity identity;
    private SimpleMeterRegistry meters;
    private final Task task = Task.of("t1", "Add login", null);

    @BeforeEach
    void setUp() {
        executor = new ScriptedCommandExecutor();
        worktrees = mock(WorktreeManager.class);
        prService = mock(PrService.class);
        identity = mock(GitHubIdentity.class);
        meters = new SimpleMeterRegistry();
        when(identity.username()).thenReturn(Optional.of("octocat"));
        when(worktrees.getBranch(any())).thenReturn("locus/add-login");
    }

    private GitWorkflow workflow(boolean autoPush) {
        return new GitWorkflow(executor, worktrees, prService, identity, "agent-1", autoPush,
                "locus", "LocusAI", "agent@locusai.team", new WorkerMetrics(meters));
    }

    // --- commitAndPush ---

    @Test
    void nothingCommittedMeansNoChanges() {
        when(worktrees.commitChanges(eq(WORKTREE), anyString(), eq("main"), eq("abc"))).thenReturn(null);

        var result = workflow(true).commitAndPush(WORKTREE, task, "main", "abc");

        assertTrue(result.noChanges());
        assertFalse(result.committed());
        assertFalse(result.failedToCommit());
        verify(worktrees, never()).pushBranch(any());
    }

    @Test
    void committedWorkIsPushed() {
        when(worktrees.commitChanges(eq(WORKTREE), anyString(), any(), any())).thenReturn("def456");
        when(worktrees.pushBranch(WORKTREE)).thenReturn("locus/add-login");

        var result = workflow(true).commitAndPush(WORKTREE, task, "main", "abc");

        assertTrue(result.pushed());
        assertEquals("locus/add-login", result.branch());
        assertEquals(1.0, meters.get("locus.git.push").tag("result", "pushed").counter().count());
    }

    @Test
    void pushFailureKeepsBranchName() {
        when(worktrees.commitChanges(eq(WORKTREE), anyString(), any(), any())).thenReturn("def456");
        when(worktrees.pushBranch(WORKTREE)).thenThrow(new CommandException("git push", 1, "rejected"));

        var result = workflow(true).commitAndPush(WORKTREE, task, "main", "abc");

        assertTrue(result.pushFailed());
        assertEquals("locus/add-login", result.branch());
        assertTrue(result.pushError().contains("rejected"));
        assertEquals(1.0, meters.get("locus.git.push").tag("result", "failed").counter().count());
    }

    @Test
    void autoPushDisabledOnlyCommits() {
        when(worktrees.commitChanges(eq(WORKTREE), anyString(), any(), any())).thenReturn("def456");

        var result = workflow(false).commitAndPush(WORKTREE, task, "main", "abc");

        assertTrue(result.committed());
        assertFalse(result.pushed());
        assertEquals(CommitPushResult.AUTO_PUSH_DISABLED_REASON, result.skipReason());
        verify(worktrees, never()).pushBranch(any());
    }

    @Test
    void commitErrorIsFoldedIntoResult() {
        when(worktrees.commitChanges(any(), anyString(), any(), any()))
                .thenThrow(new CommandException("git commit -m", 1, "hook failed"));

        var result = workflow(true).commitAndPush(WORKTREE, task, "main", "abc");

        assertFalse(result.committed());
        assertFalse(result.noChanges());
        assertTrue(result.failedToCommit());
        assertTrue(result.skipReason().startsWith("Git commit failed: "));
    }

    @Test
    void commitMessageCreditsOperatorOnlyWithAutoPush() {
        assertTrue(workflow(true).commitMessage(task)
                .endsWith("Co-authored-by: octocat <octocat@users.noreply.github.com>"));
        assertFalse(workflow(false).commitMessage(task).contains("octocat"));
        assertTrue(workflow(false).commitMessage(task).startsWith("feat(agent): Add login\n\nTask-ID: t1\nAgent: agent-1"));
    }

    @Test
    void pullRequestCarriesAgentAndSummary() {
        when(prService.createPr(any())).thenReturn(PrResult.created("https://github.com/a/b/pull/3", 3));

        var pr = workflow(true).createPullRequest(task, "locus/add-login", "Added", "main", WORKTREE);

        assertTrue(pr.isCreated());
        verify(prService).createPr(new PrRequest(task, "locus/add-login", "main", "Added", "agent-1", WORKTREE));
    }

    // --- publishRun ---

    @Test
    void publishRunMovesWorkToRunBranchAndBack() {
        var tasks = List.of(task, Task.of("t2", "Fix logout", null));
        when(worktrees.getBranch(CHECKOUT)).thenReturn("main");
        when(worktrees.hasChanges(CHECKOUT)).thenReturn(true);
        when(worktrees.commitChanges(eq(CHECKOUT), anyString())).thenReturn("aaa111");
        when(prService.createRunPr(tasks, "locus/run-agent-1-1000", "main", "agent-1", CHECKOUT))
                .thenReturn(PrResult.created("https://github.com/a/b/pull/9", 9));

        var pr = workflow(true).publishRun(CHECKOUT, tasks, 1000);

        assertEquals("https://github.com/a/b/pull/9", pr.orElseThrow().url());
        assertEquals(List.of("git checkout -b locus/run-agent-1-1000", "git checkout main"), executor.executed());
        verify(worktrees).pushBranch(CHECKOUT);
    }

    @Test
    void publishRunWithoutChangesDoesNothing() {
        when(worktrees.getBranch(CHECKOUT)).thenReturn("main");
        when(worktrees.hasChanges(CHECKOUT)).thenReturn(false);

        assertTrue(workflow(true).publishRun(CHECKOUT, List.of(task), 1000).isEmpty());
        assertTrue(executor.executed().isEmpty());
    }

    @Test
    void publishRunPushFailureStillRestoresBranch() {
        when(worktrees.getBranch(CHECKOUT)).thenReturn("main");
        when(worktrees.hasChanges(CHECKOUT)).thenReturn(true);
        when(worktrees.commitChanges(eq(CHECKOUT), anyString())).thenReturn("aaa111");
        when(worktrees.pushBranch(CHECKOUT)).thenThrow(new CommandException("git push", 128, "auth failed"));

        var pr = workflow(true).publishRun(CHECKOUT, List.of(task), 1000);

        assertFalse(pr.orElseThrow().isCreated());
        assertTrue(executor.ran("git checkout main"));
        verify(prService, never()).createRunPr(any(), any(), any(), any(), any());
    }

    @Test
    void runBranchUsesAgentSuffix() {
        var workflow = new GitWorkflow(executor, worktrees, prService, identity, "agent-12345678ABC", true,
                "locus", "LocusAI", "agent@locusai.team", null);

        assertEquals("locus/run-45678abc-77", workflow.runBranchName(77));
    }

    @Test
    void runCommitMessageListsTasks() {
        String message = workflow(true).runCommitMessage(List.of(task, Task.of("t2", "Fix logout", null)));

        assertTrue(message.startsWith("feat(agent): complete 2 tasks\n\n- Add login (t1)\n- Fix logout (t2)\n\n"));
        assertFalse(message.contains("Task-ID"));
        assertTrue(message.contains("Agent: agent-1"));
    }
}
