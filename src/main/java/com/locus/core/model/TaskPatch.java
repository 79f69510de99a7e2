package com.locus.core.model;

/**
 * Partial task update sent to the workspace server.
 *
 * <p>When {@code clearAssignee} is set the assignee is sent as an explicit
 * null, which is how a task is handed back unassigned.
 */
public record TaskPatch(
    TaskStatus status,
    String assignedTo,
    boolean clearAssignee,
    String prUrl
) {

    public static TaskPatch status(TaskStatus status) {
        return new TaskPatch(status, null, false, null);
    }

    public static TaskPatch unassigned(TaskStatus status) {
        return new TaskPatch(status, null, true, null);
    }

    public static TaskPatch inReview(String prUrl) {
        return new TaskPatch(TaskStatus.IN_REVIEW, null, false, prUrl);
    }

    public static TaskPatch prUrl(String prUrl) {
        return new TaskPatch(null, null, false, prUrl);
    }
}
