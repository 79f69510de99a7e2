package com.locus.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * A backlog task owned by the workspace server. The worker only ever writes
 * status, assignee, PR URL and comments back.
 *
 * @param id                  server-assigned identifier
 * @param title               short title, also used for branch slugs
 * @param description         markdown description
 * @param status              current status
 * @param assignedTo          agent or user currently holding the task
 * @param sprintId            sprint the task belongs to, may be null
 * @param assigneeRole        optional role hint for the prompt (e.g. "BACKEND")
 * @param acceptanceChecklist acceptance criteria items
 * @param comments            comment history, oldest first
 * @param prUrl               pull request attached to the task, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Task(
    String id,
    String title,
    String description,
    TaskStatus status,
    String assignedTo,
    String sprintId,
    String assigneeRole,
    List<String> acceptanceChecklist,
    List<TaskComment> comments,
    String prUrl
) {

    public Task {
        acceptanceChecklist = acceptanceChecklist == null ? List.of() : List.copyOf(acceptanceChecklist);
        comments = comments == null ? List.of() : List.copyOf(comments);
    }

    /**
     * Minimal task as returned by dispatch, before details are loaded.
     */
    public static Task of(String id, String title, String description) {
        return new Task(id, title, description, TaskStatus.IN_PROGRESS, null, null, null,
                List.of(), List.of(), null);
    }
}
