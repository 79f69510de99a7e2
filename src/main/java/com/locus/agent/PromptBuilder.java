package com.locus.agent;

import com.locus.core.model.Task;
import com.locus.core.model.TaskComment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Converts a Task into the prompt fed to the agent CLI.
 * Reads {@code CLAUDE.md} from the working directory when present.
 */
public final class PromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(PromptBuilder.class);

    public static final String COMPLETION_MARKER = "<promise>COMPLETE</promise>";

    static final String CONTEXT_FILE = "CLAUDE.md";
    static final int MAX_COMMENTS = 3;
    private static final int MIN_CONTEXT_LENGTH = 20;

    private PromptBuilder() {}

    public static String build(Task task, Path cwd) {
        var sb = new StringBuilder();
        sb.append("# Task: ").append(task.title()).append("\n\n");

        String role = roleText(task.assigneeRole());
        if (role != null) {
            sb.append("## Role\nYou are acting as a ").append(role).append(".\n\n");
        }

        sb.append("## Description\n");
        sb.append(isBlank(task.description()) ? "No description provided." : task.description().trim());
        sb.append("\n\n");

        String context = readProjectContext(cwd);
        if (context != null) {
            sb.append("## Project Context\n").append(context.trim()).append("\n\n");
        }

        if (!task.acceptanceChecklist().isEmpty()) {
            sb.append("## Acceptance Criteria\n");
            for (var item : task.acceptanceChecklist()) {
                sb.append("- [ ] ").append(item).append("\n");
            }
            sb.append("\n");
        }

        var comments = recentComments(task.comments());
        if (!comments.isEmpty()) {
            sb.append("## Task History & Feedback\n");
            sb.append("Review the following comments for context or rejection feedback:\n\n");
            for (var comment : comments) {
                sb.append("### ").append(comment.author());
                if (comment.createdAt() != null) {
                    sb.append(" (").append(comment.createdAt()).append(")");
                }
                sb.append("\n").append(comment.text()).append("\n\n");
            }
        }

        sb.append("## Instructions\n");
        sb.append("1. Complete this task.\n");
        sb.append("2. Use paths relative to the project root. Do NOT use absolute local paths.\n");
        sb.append("3. Do not commit, push or open pull requests; that is handled for you.\n");
        sb.append("4. When finished successfully, output: ").append(COMPLETION_MARKER).append("\n");
        return sb.toString();
    }

    /**
     * The latest comments, oldest first.
     */
    static List<TaskComment> recentComments(List<TaskComment> comments) {
        var sorted = comments.stream()
                .sorted(Comparator.comparing(TaskComment::createdAt,
                        Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
                .toList();
        return sorted.size() > MAX_COMMENTS ? sorted.subList(sorted.size() - MAX_COMMENTS, sorted.size()) : sorted;
    }

    static String roleText(String role) {
        if (isBlank(role)) {
            return null;
        }
        return switch (role.trim().toUpperCase(Locale.ROOT)) {
            case "BACKEND" -> "Backend Engineer";
            case "FRONTEND" -> "Frontend Engineer";
            case "QA" -> "QA Engineer";
            case "PM" -> "Product Manager";
            case "DESIGN" -> "UI/UX Designer";
            default -> role.trim();
        };
    }

    private static String readProjectContext(Path cwd) {
        if (cwd == null) {
            return null;
        }
        Path file = cwd.resolve(CONTEXT_FILE);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            String content = Files.readString(file);
            return content.trim().length() > MIN_CONTEXT_LENGTH ? content : null;
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
