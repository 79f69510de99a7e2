package com.locus.agent;

import com.locus.core.model.Task;
import com.locus.core.model.TaskComment;
import com.locus.core.model.TaskStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    @TempDir
    Path cwd;

    private static Task task(String role, List<String> criteria, List<TaskComment> comments) {
        return new Task("t1", "Add login", "Build the form.\n", TaskStatus.IN_PROGRESS, null, null, role,
                criteria, comments, null);
    }

    @Test
    void minimalPromptHasTitleDescriptionAndInstructions() {
        String prompt = PromptBuilder.build(Task.of("t1", "Add login", null), cwd);

        assertTrue(prompt.startsWith("# Task: Add login\n\n## Description\nNo description provided.\n\n## Instructions\n"));
        assertTrue(prompt.endsWith("4. When finished successfully, output: <promise>COMPLETE</promise>\n"));
        assertFalse(prompt.contains("## Role"));
        assertFalse(prompt.contains("## Acceptance Criteria"));
    }

    @Test
    void sectionsAppearInOrder() throws Exception {
        Files.writeString(cwd.resolve("CLAUDE.md"), "Use Java 17 and keep tests green at all times.");
        String prompt = PromptBuilder.build(task("BACKEND", List.of("Validates email"),
                List.of(TaskComment.of("pm", "Please add tests"))), cwd);

        int role = prompt.indexOf("## Role\nYou are acting as a Backend Engineer.");
        int description = prompt.indexOf("## Description\nBuild the form.\n\n");
        int context = prompt.indexOf("## Project Context\nUse Java 17");
        int criteria = prompt.indexOf("## Acceptance Criteria\n- [ ] Validates email\n");
        int history = prompt.indexOf("## Task History & Feedback\n");
        int instructions = prompt.indexOf("## Instructions\n");

        assertTrue(role > 0);
        assertTrue(role < description && description < context && context < criteria
                && criteria < history && history < instructions);
        assertTrue(prompt.contains("### pm\nPlease add tests\n"));
    }

    @Test
    void shortProjectContextIsIgnored() throws Exception {
        Files.writeString(cwd.resolve("CLAUDE.md"), "   tiny   ");

        assertFalse(PromptBuilder.build(task(null, List.of(), List.of()), cwd).contains("## Project Context"));
    }

    @Test
    void onlyTheLatestThreeCommentsAreIncluded() {
        var comments = List.of(
                new TaskComment("a", "fourth", Instant.parse("2024-05-04T00:00:00Z")),
                new TaskComment("b", "first", Instant.parse("2024-05-01T00:00:00Z")),
                new TaskComment("c", "third", Instant.parse("2024-05-03T00:00:00Z")),
                new TaskComment("d", "second", Instant.parse("2024-05-02T00:00:00Z")));

        var recent = PromptBuilder.recentComments(comments);

        assertEquals(List.of("second", "third", "fourth"), recent.stream().map(TaskComment::text).toList());
        String prompt = PromptBuilder.build(task(null, List.of(), comments), cwd);
        assertFalse(prompt.contains("first"));
        assertTrue(prompt.contains("### a (2024-05-04T00:00:00Z)\nfourth"));
    }

    @Test
    void undatedCommentsSortFirst() {
        var recent = PromptBuilder.recentComments(List.of(
                new TaskComment("a", "dated", Instant.parse("2024-05-01T00:00:00Z")),
                TaskComment.of("b", "undated")));

        assertEquals("undated", recent.get(0).text());
    }

    @Test
    void rolesMapToTitles() {
        assertEquals("QA Engineer", PromptBuilder.roleText("qa"));
        assertEquals("UI/UX Designer", PromptBuilder.roleText("DESIGN"));
        assertEquals("Data Scientist", PromptBuilder.roleText(" Data Scientist "));
        assertNull(PromptBuilder.roleText(""));
    }
}
