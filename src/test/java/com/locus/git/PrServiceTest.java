package com.locus.git;

import com.locus.core.model.Task;
import com.locus.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static com.locus.git.ScriptedCommandExecutor.fail;
import static com.locus.git.ScriptedCommandExecutor.ok;
import static org.junit.jupiter.api.Assertions.*;

class PrServiceTest {

    private static final Path WORKTREE = Path.of("/tmp/repo/.locus-worktrees/agent-1-task-1");

    private ScriptedCommandExecutor executor;
    private PrService service;
    private Task task;

    @BeforeEach
    void setUp() {
        executor = new ScriptedCommandExecutor()
                .on("remote get-url origin", ok("https://github.com/acme/app.git\n"))
                .on("rev-list --count", ok("1\n"))
                .on("gh pr create", ok("Creating pull request\nhttps://github.com/acme/app/pull/42\n"));
        service = new PrService(executor, "origin");
        task = new Task("task-1", "Add login", "Build the login page", TaskStatus.IN_PROGRESS,
                null, null, null, List.of("Form validates email"), List.of(), null);
    }

    private PrResult create() {
        return service.createPr(new PrRequest(task, "locus/add-login", "main", "Added the page", "agent-12345678", WORKTREE));
    }

    @Test
    void createsPrAndParsesNumber() {
        var result = create();

        assertTrue(result.isCreated());
        assertEquals("https://github.com/acme/app/pull/42", result.url());
        assertEquals(42, result.number());
        assertNull(result.error());
        assertTrue(executor.ran("gh pr create --title [Locus] Add login"));
        assertTrue(executor.ran("--base main --head locus/add-login"));
    }

    @Test
    void skipsNonGitHubRemote() {
        executor.on("remote get-url origin", ok("git@gitlab.com:acme/app.git\n"));

        var result = create();

        assertFalse(result.isCreated());
        assertTrue(result.error().contains("not a GitHub repository"));
        assertFalse(executor.ran("gh pr create"));
    }

    @Test
    void skipsWhenGhIsMissing() {
        executor.on("gh --version", fail(127, "command not found"));

        assertEquals("GitHub CLI (gh) is not installed", create().error());
    }

    @Test
    void skipsWhenHeadBranchWasNotPushed() {
        executor.on("--heads origin locus/add-login", fail(2, ""));

        var result = create();

        assertTrue(result.error().contains("was not found on origin"));
    }

    @Test
    void skipsBranchWithoutCommitsAhead() {
        executor.on("rev-list --count", ok("0\n"));

        var result = create();

        assertTrue(result.error().contains("no commits ahead of 'main'"));
        assertFalse(executor.ran("gh pr create"));
    }

    @Test
    void reportsGhFailureWithoutThrowing() {
        executor.on("gh pr create", fail(1, "a pull request already exists"));

        var result = create();

        assertFalse(result.isCreated());
        assertEquals("gh pr create failed: a pull request already exists", result.error());
    }

    @Test
    void runPrTitleCountsTasks() {
        var other = Task.of("task-2", "Fix logout", null);

        var result = service.createRunPr(List.of(task, other), "locus/run-x", "main", "agent-12345678", WORKTREE);

        assertTrue(result.isCreated());
        assertTrue(executor.ran("--title [Locus] 2 tasks by agent 12345678"));
    }

    // --- body ---

    @Test
    void bodyListsCriteriaSummaryAndFooter() {
        String body = PrService.buildBody(task, "Added the page", "agent-12345678");

        assertTrue(body.startsWith("## Task: Add login\n\nBuild the login page"));
        assertTrue(body.contains("## Acceptance Criteria\n\n- [ ] Form validates email\n"));
        assertTrue(body.contains("## Agent Summary\n\nAdded the page"));
        assertTrue(body.endsWith("*Created by Locus Agent `12345678`* | Task ID: `task-1`"));
    }

    @Test
    void bodyOmitsEmptySections() {
        String body = PrService.buildBody(Task.of("t", "Title", null), null, "a1");

        assertFalse(body.contains("Acceptance Criteria"));
        assertFalse(body.contains("Agent Summary"));
    }

    @Test
    void runBodyListsEveryTask() {
        String body = PrService.buildRunBody(List.of(task, Task.of("task-2", "Fix logout", null)), "agent-1");

        assertTrue(body.contains("- **Add login** (`task-1`)"));
        assertTrue(body.contains("- **Fix logout** (`task-2`)"));
    }

    @Test
    void parsesPrNumberFromUrl() {
        assertEquals(7, PrService.parsePrNumber("https://github.com/a/b/pull/7"));
        assertNull(PrService.parsePrNumber("https://github.com/a/b"));
        assertNull(PrService.parsePrNumber(null));
    }
}
